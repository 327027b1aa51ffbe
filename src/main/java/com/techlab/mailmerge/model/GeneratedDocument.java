package com.techlab.mailmerge.model;

import lombok.Value;

@Value
public class GeneratedDocument {
    byte[] content;
    String filename;
}
