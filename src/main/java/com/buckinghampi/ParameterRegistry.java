package com.buckinghampi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, duplicate-free set of parameters keyed by symbol. Owned by the
 * caller and handed to {@link BuckinghamPi}; not thread-safe.
 *
 * <p>Registration is all-or-nothing: every value of a call is validated
 * before the registry changes.
 */
public final class ParameterRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParameterRegistry.class);

    private final Map<String, Parameter> parameters = new LinkedHashMap<>();

    public ParameterRegistry() {}

    /** Empties the registry, then registers {@code params} in order. */
    public ParameterRegistry setParameters(List<Parameter> params) {
        List<Parameter> checked = checked(params);
        parameters.clear();
        checked.forEach(this::append);
        return this;
    }

    /** Replaces the contents with {@code symbol, value, symbol, value, ...}. */
    public ParameterRegistry setParameters(Object... symbolsAndValues) {
        return setParameters(toParameters(symbolsAndValues));
    }

    /** Appends each parameter whose symbol is not registered yet; others are ignored. */
    public ParameterRegistry addParameters(List<Parameter> params) {
        checked(params).forEach(this::append);
        return this;
    }

    public ParameterRegistry addParameters(Object... symbolsAndValues) {
        return addParameters(toParameters(symbolsAndValues));
    }

    public ParameterRegistry addParameter(String symbol, Object value) {
        append(Parameter.of(symbol, value));
        return this;
    }

    public void clear() { parameters.clear(); }

    public int size() { return parameters.size(); }

    public boolean isEmpty() { return parameters.isEmpty(); }

    public boolean contains(String symbol) { return parameters.containsKey(symbol); }

    /** Snapshot in registration order. */
    public List<Parameter> parameters() {
        return Collections.unmodifiableList(new ArrayList<>(parameters.values()));
    }

    public List<String> symbols() {
        return Collections.unmodifiableList(new ArrayList<>(parameters.keySet()));
    }

    /** Symbol to {@link Parameter#magnitude()}, for evaluating expressions. */
    public Map<String, Double> magnitudes() {
        Map<String, Double> out = new LinkedHashMap<>();
        parameters.forEach((s, p) -> out.put(s, p.magnitude()));
        return out;
    }

    /** Logs the registered parameters at INFO. */
    public void display() {
        log.info("Parameter(s) registered:");
        for (Parameter p : parameters.values()) {
            log.info(" {} = {}", p.symbol(), p.value());
        }
    }

    // copy first, then reject nulls, so a failed call leaves the registry as it was
    private static List<Parameter> checked(List<Parameter> params) {
        Objects.requireNonNull(params, "params");
        List<Parameter> copy = new ArrayList<>(params);
        for (int i = 0; i < copy.size(); i++) {
            Objects.requireNonNull(copy.get(i), "parameter at position " + i);
        }
        return copy;
    }

    private void append(Parameter p) {
        parameters.putIfAbsent(p.symbol(), p);
    }

    private static List<Parameter> toParameters(Object... symbolsAndValues) {
        if (symbolsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected symbol/value pairs, got " + symbolsAndValues.length + " arguments");
        }
        List<Parameter> out = new ArrayList<>(symbolsAndValues.length / 2);
        for (int i = 0; i < symbolsAndValues.length; i += 2) {
            Object symbol = symbolsAndValues[i];
            if (!(symbol instanceof String)) {
                throw new IllegalArgumentException("Parameter symbol at position " + i + " is not a String: " + symbol);
            }
            out.add(Parameter.of((String) symbol, symbolsAndValues[i + 1]));
        }
        return out;
    }

    @Override public String toString() { return parameters.values().toString(); }
}
