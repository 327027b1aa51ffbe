package com.techlab.mailmerge.model;

import lombok.Value;

@Value
public class TableRef {
    String id;
}
