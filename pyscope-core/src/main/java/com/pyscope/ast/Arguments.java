package com.pyscope.ast;

import java.util.List;
import java.util.Optional;

/**
 * Parameters of a function or lambda.
 *
 * <p>{@code args} holds AssignName nodes, or TupleLiteral nodes for nested
 * tuple parameters. {@code defaults} lines up with the tail of {@code args};
 * {@code kwDefaults} lines up with {@code kwonlyargs} and may hold nulls.</p>
 */
public record Arguments(
    int line,
    int col,
    List<Expression> args,
    String vararg,  // Can be null
    String kwarg,   // Can be null
    List<Expression> defaults,
    List<Expression> kwonlyargs,
    List<Expression> kwDefaults
) implements AssignType {

    public static Arguments empty() {
        return new Arguments(0, 0, List.of(), null, null, List.of(), List.of(), List.of());
    }

    /**
     * Returns the default value of the named argument.
     *
     * @throws NoDefaultException if the argument is unknown or has no default
     */
    public Expression defaultValue(String argName) {
        Match positional = find(argName, args, false);
        if (positional != null) {
            int index = positional.index() - (args.size() - defaults.size());
            if (index >= 0) {
                return defaults.get(index);
            }
        }
        Match keywordOnly = find(argName, kwonlyargs, false);
        if (keywordOnly != null
                && keywordOnly.index() < kwDefaults.size()
                && kwDefaults.get(keywordOnly.index()) != null) {
            return kwDefaults.get(keywordOnly.index());
        }
        throw new NoDefaultException(argName);
    }

    /**
     * Whether {@code name} is a parameter, including {@code *args},
     * {@code **kwargs} and names inside nested tuple parameters.
     */
    public boolean isArgument(String name) {
        if (name.equals(vararg) || name.equals(kwarg)) {
            return true;
        }
        return findArgName(name, true).isPresent();
    }

    public Optional<AssignName> findArgName(String name, boolean recursive) {
        Match match = find(name, args, recursive);
        return match == null ? Optional.empty() : Optional.of(match.arg());
    }

    private record Match(int index, AssignName arg) {}

    private static Match find(String name, List<Expression> candidates, boolean recursive) {
        for (int i = 0; i < candidates.size(); i++) {
            Expression candidate = candidates.get(i);
            if (candidate instanceof TupleLiteral tuple) {
                if (recursive) {
                    Match nested = find(name, tuple.elts(), false);
                    if (nested != null) {
                        return nested;
                    }
                }
            } else if (candidate instanceof AssignName arg && arg.name().equals(name)) {
                return new Match(i, arg);
            }
        }
        return null;
    }

    @Override
    public String type() {
        return "Arguments";
    }
}
