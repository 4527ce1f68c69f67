package com.foreman.core.execution;

/**
 * @param continuationPrompt prompt that replaces the feature prompt, e.g. after a restart
 * @param allowReuse         reuse an existing registry entry instead of failing when the feature
 *                           is already registered (nested internal calls only)
 */
public record ExecutionOptions(String continuationPrompt, boolean allowReuse) {

    public static final ExecutionOptions DEFAULT = new ExecutionOptions(null, false);

    public static ExecutionOptions continuation(String prompt) {
        return new ExecutionOptions(prompt, false);
    }
}
