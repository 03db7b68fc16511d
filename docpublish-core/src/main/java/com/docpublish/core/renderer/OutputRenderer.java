package com.docpublish.core.renderer;

/**
 * Emits the files a writer produced to a destination.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(context.resolve(file), file.content(), context.encoding());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer. Should be lowercase
     * (e.g., "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Emits every file of the output.
     *
     * @param output generated files
     * @param context destination settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
