package jobqueue.content;

import jobqueue.registry.DefaultHandlerRegistry;

/**
 * Registers the content handlers under their {@link ContentJobType}s.
 */
public final class ContentHandlers {

  private ContentHandlers() {
  }

  public static DefaultHandlerRegistry register(DefaultHandlerRegistry registry,
      GenerateContentHandler generate, DistributeContentHandler distribute) {
    return registry
        .register(ContentJobType.GENERATE_CONTENT, generate)
        .register(ContentJobType.DISTRIBUTE_CONTENT, distribute);
  }
}
