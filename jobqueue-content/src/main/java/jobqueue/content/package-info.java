/**
 * Content job handlers: AI-assisted draft generation and multi-channel distribution.
 *
 * <p>{@link jobqueue.content.ContentHandlers} registers both handlers on a
 * {@link jobqueue.registry.DefaultHandlerRegistry}:
 *
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
 * ContentHandlers.register(registry,
 *     new GenerateContentHandler(generator, drafts, authors),
 *     new DistributeContentHandler(distributor));
 * }</pre>
 */
package jobqueue.content;
