package io.tasktree.core.node.leaf;

import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.function.BlackboardSetter;
import io.tasktree.core.function.Functions;
import io.tasktree.core.json.JacksonJsonLoader;
import io.tasktree.core.json.JsonLoader;

/// Where a {@link ParseJsonNode} reads its text, where it writes the parsed
/// value, and how it parses.
///
/// ### Defaults
/// - source: the data of the previous result
/// - destination: none (the parsed value is only returned)
/// - loader: {@link JacksonJsonLoader}
///
/// @param <B> blackboard type
public final class ParseJsonSettings<B> {

    private final BlackboardFunction<B, ?> source;
    private final BlackboardSetter<B> destination;
    private final JsonLoader loader;

    private ParseJsonSettings(Builder<B> builder) {
        this.source = builder.source;
        this.destination = builder.destination;
        this.loader = builder.loader != null ? builder.loader : new JacksonJsonLoader();
    }

    public static <B> ParseJsonSettings<B> defaults() {
        return new Builder<B>().build();
    }

    /// @return the source getter, or null to read the previous result
    public BlackboardFunction<B, ?> getSource() {
        return source;
    }

    /// @return the destination setter, or null for no write
    public BlackboardSetter<B> getDestination() {
        return destination;
    }

    public JsonLoader getLoader() {
        return loader;
    }

    public static <B> Builder<B> builder() {
        return new Builder<>();
    }

    public static final class Builder<B> {
        private BlackboardFunction<B, ?> source;
        private BlackboardSetter<B> destination;
        private JsonLoader loader;

        private Builder() {}

        public Builder<B> source(String attribute) {
            this.source = Functions.getter(attribute);
            return this;
        }

        public Builder<B> source(BlackboardFunction<B, ?> getter) {
            this.source = getter;
            return this;
        }

        public Builder<B> destination(String attribute) {
            this.destination = Functions.setter(attribute);
            return this;
        }

        public Builder<B> destination(BlackboardSetter<B> setter) {
            this.destination = setter;
            return this;
        }

        public Builder<B> loader(JsonLoader loader) {
            this.loader = loader;
            return this;
        }

        public ParseJsonSettings<B> build() {
            return new ParseJsonSettings<>(this);
        }
    }
}
