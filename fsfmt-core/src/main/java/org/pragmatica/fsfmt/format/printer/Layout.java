package org.pragmatica.fsfmt.format.printer;

/**
 * Deferred rendering step. Layouts are built once per node and may be applied to a trial
 * context and to the real context.
 */
@FunctionalInterface
public interface Layout {
    RenderContext apply(RenderContext context);
}
