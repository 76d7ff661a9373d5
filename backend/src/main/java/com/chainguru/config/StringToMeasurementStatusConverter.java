package com.chainguru.config;

import com.chainguru.domain.MeasurementStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * Reads the stored status back; accepts the legacy upper-case form too.
 */
@ReadingConverter
public class StringToMeasurementStatusConverter implements Converter<String, MeasurementStatus> {

    @Override
    public MeasurementStatus convert(String source) {
        return MeasurementStatus.fromWireValue(source);
    }
}
