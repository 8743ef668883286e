package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.api.FunctionContext;

/**
 * What the renderer learned about one function body while buffering it.
 *
 * @param context      The function.
 * @param instructions Number of instruction lines in the body, comment-only lines excluded.
 * @param terminated   Whether an end-of-function marker closed the body.
 */
public record FunctionSummary(FunctionContext context, int instructions, boolean terminated) {
}
