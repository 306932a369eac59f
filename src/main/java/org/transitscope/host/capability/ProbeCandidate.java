package org.transitscope.host.capability;

import java.util.ArrayList;
import java.util.List;

/**
 * One way of fulfilling a capability: a host function plus the leading arguments it is
 * always called with (for instance an entity type constant).
 *
 * @param function  The host function name.
 * @param fixedArgs Arguments placed before any per-call arguments.
 * @param label     A human readable description used in diagnostics.
 */
public record ProbeCandidate(String function, List<Object> fixedArgs, String label) {

    public ProbeCandidate {
        fixedArgs = List.copyOf(fixedArgs);
    }

    public static ProbeCandidate call(String function) {
        return new ProbeCandidate(function, List.of(), function + "()");
    }

    public static ProbeCandidate callWith(String function, Object fixedArg, String argLabel) {
        return new ProbeCandidate(function, List.of(fixedArg), function + "(" + argLabel + ")");
    }

    /**
     * Builds the full argument array for an invocation.
     *
     * @param callArgs The per-call arguments appended after the fixed ones.
     * @return The combined argument array.
     */
    public Object[] arguments(Object... callArgs) {
        List<Object> all = new ArrayList<>(fixedArgs);
        for (Object arg : callArgs) {
            all.add(arg);
        }
        return all.toArray();
    }
}
