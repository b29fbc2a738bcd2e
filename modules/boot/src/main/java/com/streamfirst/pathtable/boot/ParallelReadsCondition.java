package com.streamfirst.pathtable.boot;

import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code pathtable.read-threads} asks for at least one reader thread.
 */
class ParallelReadsCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return Binder.get(context.getEnvironment())
            .bind("pathtable.read-threads", Integer.class)
            .map(threads -> threads > 0)
            .orElse(false);
    }
}
