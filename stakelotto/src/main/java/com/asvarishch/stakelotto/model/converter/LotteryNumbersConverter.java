package com.asvarishch.stakelotto.model.converter;

import com.asvarishch.stakelotto.util.LotteryNumbers;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/** Stores five sorted numbers as "1,5,15,25,35"; empty string until drawn. */
@Converter
public class LotteryNumbersConverter implements AttributeConverter<List<Integer>, String> {

    @Override
    public String convertToDatabaseColumn(List<Integer> numbers) {
        return LotteryNumbers.encode(numbers);
    }

    @Override
    public List<Integer> convertToEntityAttribute(String column) {
        return LotteryNumbers.decode(column);
    }
}
