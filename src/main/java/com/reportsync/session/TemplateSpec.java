package com.reportsync.session;

import java.util.List;

/**
 * Report template selection: the download range (matched by visible text) and the template (matched by value).
 */
public record TemplateSpec(String rangeLabel, String templateValue) {

    public TemplateSpec {
        rangeLabel = rangeLabel == null ? "" : rangeLabel.trim();
        templateValue = templateValue == null ? "" : templateValue.trim();
    }

    public static TemplateSpec parse(List<String> parts) {
        if (parts == null || parts.size() < 2) {
            throw new IllegalArgumentException("template needs <range label>,<template value>: " + parts);
        }
        return new TemplateSpec(parts.get(0), parts.get(1));
    }
}
