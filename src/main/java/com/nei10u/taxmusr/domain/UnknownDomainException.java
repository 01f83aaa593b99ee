package com.nei10u.taxmusr.domain;

public class UnknownDomainException extends IllegalArgumentException {

    public UnknownDomainException(String domain) {
        super("Unknown domain: " + domain);
    }
}
