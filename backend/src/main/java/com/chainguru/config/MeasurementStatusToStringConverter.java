package com.chainguru.config;

import com.chainguru.domain.MeasurementStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * Writes MeasurementStatus as "success" / "error" / "skipped".
 */
@WritingConverter
public class MeasurementStatusToStringConverter implements Converter<MeasurementStatus, String> {

    @Override
    public String convert(MeasurementStatus source) {
        return source.wireValue();
    }
}
