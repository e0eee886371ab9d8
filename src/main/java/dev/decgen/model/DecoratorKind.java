package dev.decgen.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of decorators, with the literal accepted on the command line.
 */
public enum DecoratorKind {
    SERIALIZE_ACCESS("mutex"),
    TRACE("trace"),
    TRANSACTION_WRAP("sqltx"),
    RPC_ADAPTER("grpcadapter");

    private final String literal;

    DecoratorKind(String literal) {
        this.literal = literal;
    }

    public String literal() {
        return literal;
    }

    public static Optional<DecoratorKind> fromLiteral(String literal) {
        for (DecoratorKind kind : values()) {
            if (kind.literal.equals(literal)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static List<String> literals() {
        final List<String> out = new ArrayList<>();
        for (DecoratorKind kind : values()) {
            out.add(kind.literal);
        }
        return out;
    }
}
