package dev.decgen.render;

import java.util.ArrayList;
import java.util.List;

import dev.decgen.model.Parameter;
import dev.decgen.model.Result;

/**
 * Position-based names for generated parameters and result bindings.
 * Names depend only on the shape of the parameter list, so output is stable across runs.
 */
public final class ParameterNames {

    public static final String CONTEXT = "ctx";
    public static final String REQUEST = "req";
    public static final String ERROR = "err";

    private ParameterNames() {
    }

    public static String nameOf(int index, List<Parameter> parameters) {
        final Parameter param = parameters.get(index);

        // a leading context carrier is always ctx
        if (index == 0 && param.type().isContext()) {
            return CONTEXT;
        }

        // context plus a single request
        if (parameters.size() == 2 && index == 1) {
            return REQUEST;
        }

        return "param" + index;
    }

    public static List<String> namesOf(List<Parameter> parameters) {
        final List<String> names = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            names.add(nameOf(i, parameters));
        }
        return names;
    }

    /**
     * Argument list of the delegated call. A varargs parameter is passed on as its array.
     *
     * @param dropLast leave out the trailing parameter (call options of an RPC client)
     */
    public static String callArguments(List<Parameter> parameters, boolean dropLast) {
        final List<String> names = namesOf(parameters);
        final int count = dropLast ? Math.max(0, names.size() - 1) : names.size();
        return String.join(", ", names.subList(0, count));
    }

    public static String bindingOf(Result result) {
        return result.terminalError() ? ERROR : "arg" + result.index();
    }
}
