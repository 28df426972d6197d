package com.purchasingpower.autoreview.service.mapping;

import com.purchasingpower.autoreview.config.LineMappingConfig;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.service.DiffParserService;
import com.purchasingpower.autoreview.service.format.LineMappingReportGenerator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates one {@link LineMapper} per review request, bound to the configured thresholds.
 */
@Service
@RequiredArgsConstructor
public class LineMapperFactory {

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(LineMapper.class);

    private final DiffParserService diffParser;
    private final LineMappingConfig config;
    private final LineMappingReportGenerator reportGenerator;

    public LineMapper create(List<ParsedFileDiff> parsedFiles) {
        return create(parsedFiles, DEFAULT_LOGGER);
    }

    /**
     * @param log where resolution tiers are reported, e.g. a per-review logger
     */
    public LineMapper create(List<ParsedFileDiff> parsedFiles, Logger log) {
        return new LineMapper(parsedFiles, config, reportGenerator, log);
    }

    public LineMapper fromDiff(String diffText) {
        return create(diffParser.parse(diffText));
    }
}
