package com.vidnyan.reqtrace.adapter.out.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vidnyan.reqtrace.application.port.out.TraceConfigSource;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.config.ImplConfig;
import com.vidnyan.reqtrace.domain.config.SpecConfig;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.error.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * File system based configuration source.
 * Reads a YAML document, or JSON when the file name ends in {@code .json}.
 */
@Slf4j
@Component
public class FileTraceConfigSource implements TraceConfigSource {

    private final Path configFile;
    private final ObjectMapper mapper;

    @Autowired
    public FileTraceConfigSource(ReqTraceProperties properties, ObjectMapper objectMapper) {
        this(properties.configFilePath(), objectMapper);
    }

    public FileTraceConfigSource(Path configFile, ObjectMapper objectMapper) {
        this.configFile = configFile;
        this.mapper = isJson(configFile) ? objectMapper : yamlMapper();
    }

    @Override
    public TraceConfig load() {
        String content;
        try {
            content = Files.readString(configFile);
        } catch (NoSuchFileException e) {
            throw new ConfigException("Configuration not found: " + configFile, e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read configuration " + configFile + ": " + e.getMessage(), e);
        }

        ConfigDto dto;
        try {
            dto = mapper.readValue(content, ConfigDto.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Cannot parse configuration " + configFile + ": "
                    + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new ConfigException("Configuration is empty: " + configFile);
        }

        TraceConfig config = mapToConfig(dto);
        log.debug("Loaded {} specs from {}", config.specs().size(), configFile);
        return config;
    }

    @Override
    public String describe() {
        return configFile.toString();
    }

    private TraceConfig mapToConfig(ConfigDto dto) {
        List<SpecConfig> specs = dto.specs == null ? List.of() : dto.specs.stream()
                .map(this::mapSpec)
                .toList();
        return new TraceConfig(specs);
    }

    private SpecConfig mapSpec(SpecDto dto) {
        List<ImplConfig> impls = dto.impls == null ? List.of() : dto.impls.stream()
                .map(i -> new ImplConfig(nullToEmpty(i.name), i.include, i.exclude, i.testInclude))
                .toList();
        return new SpecConfig(nullToEmpty(dto.name), nullToEmpty(dto.prefix), dto.sourceUrl, dto.include, impls);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isJson(Path file) {
        return file.getFileName() != null
                && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static ObjectMapper yamlMapper() {
        return YAMLMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    // DTOs for JSON/YAML parsing
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigDto {
        public List<SpecDto> specs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SpecDto {
        public String name;
        public String prefix;
        public String sourceUrl;
        public List<String> include;
        public List<ImplDto> impls;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ImplDto {
        public String name;
        public List<String> include;
        public List<String> exclude;
        public List<String> testInclude;
    }
}
