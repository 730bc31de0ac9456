package com.gentoro.substrate.reference;

public record DeleteResult(String name, boolean deleted) {}
