package com.streamfirst.pathtable.boot;

import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.Map;

/**
 * Matches when at least one source is declared under {@code pathtable.sources}.
 */
class SourcesConfiguredCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return Binder.get(context.getEnvironment())
            .bind("pathtable.sources", Bindable.mapOf(String.class, PathTableProperties.Source.class))
            .map(Map::isEmpty)
            .map(empty -> !empty)
            .orElse(false);
    }
}
