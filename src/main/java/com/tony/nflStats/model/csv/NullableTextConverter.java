package com.tony.nflStats.model.csv;

import com.opencsv.bean.AbstractBeanField;

/**
 * Colonne texte : "NA" ou vide deviennent null.
 */
public class NullableTextConverter<T, I> extends AbstractBeanField<T, I> {

    @Override
    protected Object convert(String value) {
        return MissingValues.text(value);
    }
}
