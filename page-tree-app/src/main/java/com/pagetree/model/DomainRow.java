package com.pagetree.model;

public record DomainRow(
    int rootId,
    String domainName,
    boolean forced   // overrides a binding seen earlier for the same root
) {}
