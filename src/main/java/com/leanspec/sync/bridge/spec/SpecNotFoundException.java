package com.leanspec.sync.bridge.spec;

public class SpecNotFoundException extends RuntimeException {

    public SpecNotFoundException(String specName) {
        super("Spec not found: " + specName);
    }
}
