package io.b2mash.b2b.backofficeaudit.event;

import java.util.function.Consumer;

/**
 * Raises {@link AuditableEvent}s to subscribed handlers. Handlers run synchronously on the thread
 * that raised the event; an exception thrown by a handler propagates to the raising side.
 */
public interface AuditEventSource {

  /**
   * Subscribes {@code handler} to every event of the given kind.
   *
   * @param kind the event kind, reserved kinds included
   * @param payloadType record type events of this kind are raised as
   * @param handler invoked once per raised event
   * @throws IllegalArgumentException if events of {@code kind} are not raised as {@code
   *     payloadType}
   */
  <E extends AuditableEvent> void subscribe(
      AuditEventKind kind, Class<E> payloadType, Consumer<? super E> handler);
}
