package dev.blanke.cobfuscator.ast;

import java.util.Objects;

/**
 * A member access {@code base.member}, or {@code base->member} if {@code arrow} is set.
 */
public record MemberExpression(Expression base, String member, boolean arrow) implements Expression {

    public MemberExpression {
        Objects.requireNonNull(base);
        Objects.requireNonNull(member);
    }
}
