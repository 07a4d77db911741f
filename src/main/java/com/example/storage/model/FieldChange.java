package com.example.storage.model;

import lombok.Value;

@Value
public class FieldChange {
    Object oldValue;
    Object newValue;
    boolean changed;
}
