package com.example.storage.sql;

import lombok.Value;

import java.util.List;

@Value
public class SqlStatement {
    String sql;
    List<Object> params;

    public Object[] args() {
        return params.toArray();
    }

    @Override
    public String toString() {
        return sql;
    }
}
