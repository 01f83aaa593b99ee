package com.nei10u.taxmusr.support;

import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.oracle.OracleResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Deterministic oracle for tests: records every call and answers through a scripted function.
 */
public class ScriptedOracle implements GenerationOracle {

    public record Call(String template, Map<String, Object> variables) {

        public String variable(String name) {
            Object value = variables.get(name);
            return value == null ? null : value.toString();
        }

        public boolean isNarrative() {
            return variables.containsKey("facts_list");
        }
    }

    private final Function<Call, String> responder;
    private final List<Call> calls = new ArrayList<>();

    public ScriptedOracle(Function<Call, String> responder) {
        this.responder = responder;
    }

    public static ScriptedOracle silent() {
        return new ScriptedOracle(call -> call.isNarrative() ? "A short story." : "");
    }

    @Override
    public OracleResponse generate(String template, Map<String, Object> variables, GenerationSettings settings) {
        Call call = new Call(template, new LinkedHashMap<>(variables));
        calls.add(call);
        return OracleResponse.of(responder.apply(call));
    }

    public List<Call> calls() {
        return calls;
    }

    public List<Call> expansionCalls() {
        return calls.stream().filter(c -> c.variables().containsKey("fact")).toList();
    }
}
