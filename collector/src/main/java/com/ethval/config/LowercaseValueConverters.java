package com.ethval.config;

import com.ethval.domain.CollectionLog.LogType;
import com.ethval.domain.CollectionStatus.CollectionStatusValue;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.util.List;

/**
 * Bookkeeping enums are stored as their lowercase values ("success", "warning") rather than constant names.
 */
final class LowercaseValueConverters {

    private LowercaseValueConverters() {
    }

    static List<Converter<?, ?>> all() {
        return List.of(
                new StatusToString(), new StringToStatus(),
                new LogTypeToString(), new StringToLogType());
    }

    @WritingConverter
    static class StatusToString implements Converter<CollectionStatusValue, String> {
        @Override
        public String convert(CollectionStatusValue source) {
            return source.value();
        }
    }

    @ReadingConverter
    static class StringToStatus implements Converter<String, CollectionStatusValue> {
        @Override
        public CollectionStatusValue convert(String source) {
            return CollectionStatusValue.fromValue(source);
        }
    }

    @WritingConverter
    static class LogTypeToString implements Converter<LogType, String> {
        @Override
        public String convert(LogType source) {
            return source.value();
        }
    }

    @ReadingConverter
    static class StringToLogType implements Converter<String, LogType> {
        @Override
        public LogType convert(String source) {
            return LogType.fromValue(source);
        }
    }
}
