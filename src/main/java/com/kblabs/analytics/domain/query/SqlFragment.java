package com.kblabs.analytics.domain.query;

import lombok.Value;

import java.util.List;

/** SQL text with its positional ({@code ?}) bind parameters, in order. */
@Value
public class SqlFragment {

    String sql;
    List<Object> params;

    public static SqlFragment empty() {
        return new SqlFragment("", List.of());
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }

    public Object[] paramsArray() {
        return params.toArray();
    }
}
