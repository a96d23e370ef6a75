package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;

/**
 * Resolves one non-generic {@link Category} directly against the schedule store and the game API.
 *
 * <p>Implementations never throw and never return blank text: when nothing matches, or a
 * collaborator is unavailable, they answer with the category's no-data message.
 */
public interface CategoryHandler {

  Category category();

  String handle(HandlerRequest request);
}
