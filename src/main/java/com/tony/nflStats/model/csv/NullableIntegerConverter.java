package com.tony.nflStats.model.csv;

import com.opencsv.bean.AbstractBeanField;
import com.opencsv.exceptions.CsvDataTypeMismatchException;

/**
 * Colonne entière : "NA" ou vide deviennent null, "12.0" vaut 12.
 */
public class NullableIntegerConverter<T, I> extends AbstractBeanField<T, I> {

    @Override
    protected Object convert(String value) throws CsvDataTypeMismatchException {
        if (MissingValues.isMissing(value)) return null;
        Integer parsed = MissingValues.parseInteger(value);
        if (parsed == null) {
            throw new CsvDataTypeMismatchException(value, Integer.class, "Entier illisible : " + value);
        }
        return parsed;
    }
}
