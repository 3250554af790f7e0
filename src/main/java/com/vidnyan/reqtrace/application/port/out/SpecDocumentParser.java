package com.vidnyan.reqtrace.application.port.out;

import com.vidnyan.reqtrace.domain.model.Rule;

import java.util.List;

/**
 * Port for turning one specification document into rule declarations.
 */
public interface SpecDocumentParser {

    /**
     * Parse a document. Every marker is returned, duplicates included, in document order.
     *
     * @param spec    owning spec name, stamped on each rule
     * @param prefix  marker prefix, e.g. {@code r}
     * @param path    project-relative document path, used for rule locations
     * @param content raw markdown
     */
    List<Rule> parse(String spec, String prefix, String path, String content);
}
