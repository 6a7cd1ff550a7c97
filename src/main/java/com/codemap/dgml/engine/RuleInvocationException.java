package com.codemap.dgml.engine;

import com.codemap.dgml.builder.ElementBuilder;

/** A builder or style rule failed while processing one element. */
public class RuleInvocationException extends GraphAssemblyException {
    private static final long serialVersionUID = 1L;

    private final transient ElementBuilder<?, ?> rule;
    private final transient Object input;

    public RuleInvocationException(ElementBuilder<?, ?> rule, Object input, Throwable cause) {
        super("Rule " + rule + " failed on input of type " + input.getClass().getName() + ": "
                + cause.getMessage(), cause);
        this.rule = rule;
        this.input = input;
    }

    public ElementBuilder<?, ?> getRule() {
        return rule;
    }

    /** The domain object (or, for style rules, the node or link) being processed. */
    public Object getInput() {
        return input;
    }
}
