package com.docpublish.core.transform;

import com.docpublish.core.error.TransformCondition;
import com.docpublish.core.settings.SettingsSpec;

/**
 * A unit of tree rewriting.
 *
 * <p>Transforms are run by the {@link TransformScheduler} in ascending priority; transforms with
 * the same priority run in the order they were scheduled. Problems with the tree are reported by
 * throwing a {@link TransformCondition}; the scheduler records it in the document and decides
 * whether the run continues.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class StripCommentsTransform implements Transform {
 *     @Override
 *     public String getId() {
 *         return "strip-comments";
 *     }
 *
 *     @Override
 *     public int getPriority() {
 *         return 740;
 *     }
 *
 *     @Override
 *     public void apply(TransformContext context) {
 *         // remove COMMENT nodes below context.target()
 *     }
 * }
 * }</pre>
 *
 * <p>Priority ranges used by the stock transforms:
 * <ul>
 *   <li>200-399: structural fix-ups (ids, document title)</li>
 *   <li>700-899: filtering and clean-up</li>
 *   <li>950: ad-hoc callables (see {@link TransformSpec#callable})</li>
 * </ul>
 */
public interface Transform extends SettingsSpec {

    /** Lowest legal priority. */
    int MIN_PRIORITY = 0;

    /** Highest legal priority. */
    int MAX_PRIORITY = 999;

    /**
     * Returns unique identifier for this transform. Should be kebab-case
     * (e.g., "doc-title", "strip-comments").
     *
     * @return transform identifier
     */
    String getId();

    /**
     * Returns execution priority, lower values run earlier.
     *
     * @return priority in {@code 0..999}
     */
    int getPriority();

    /**
     * Rewrites the subtree rooted at {@link TransformContext#target()}.
     *
     * @param context document, target, settings and scheduling access
     * @throws TransformCondition to report a problem
     */
    void apply(TransformContext context);
}
