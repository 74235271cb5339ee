package com.nsmctl.commandline.iface;

/**
 * Anything that owns a grammar and can act on values parsed against it.
 *
 * @param <R> what one execution pass returns
 */
public interface CommandInterface<R> {

    String getName();

    String getDescription();

    Grammar getGrammar();

    /**
     * Acts on values previously parsed against {@link #getGrammar()}.
     *
     * Errors raised by target objects propagate unchanged.
     */
    R execute(ParsedArguments arguments) throws Exception;

    default ParsedArguments parse(String... args) {
        return getGrammar().parse(args);
    }

    default R run(String... args) throws Exception {
        return execute(parse(args));
    }
}
