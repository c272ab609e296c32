package com.findawise.pointers.application.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Set of pointer ids awaiting validation.
 *
 * <p>Each enqueue assigns a fresh ticket. A cycle works on a snapshot of tickets and completes only the
 * tickets it saw, so a pointer re-queued while its previous ticket is in flight stays queued for the
 * next cycle.</p>
 *
 * @since 0.1.0
 */
public final class ValidationQueue {
  private final Map<String, Long> tickets = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Queues a pointer, replacing any ticket it already holds.
   *
   * @param pointerId pointer to validate
   * @return new ticket
   */
  public long enqueue(String pointerId) {
    Objects.requireNonNull(pointerId, "pointerId");
    long ticket = sequence.incrementAndGet();
    tickets.put(pointerId, ticket);
    return ticket;
  }

  public boolean remove(String pointerId) {
    return tickets.remove(pointerId) != null;
  }

  public boolean contains(String pointerId) {
    return tickets.containsKey(pointerId);
  }

  public OptionalLong ticketOf(String pointerId) {
    Long ticket = tickets.get(pointerId);
    return ticket == null ? OptionalLong.empty() : OptionalLong.of(ticket);
  }

  /**
   * Returns the queued entries ordered by ticket, oldest first.
   *
   * @return immutable snapshot
   */
  public List<Ticket> snapshot() {
    List<Ticket> result = new ArrayList<>(tickets.size());
    for (Map.Entry<String, Long> entry : tickets.entrySet()) {
      result.add(new Ticket(entry.getKey(), entry.getValue()));
    }
    result.sort(Comparator.comparingLong(Ticket::ticket));
    return List.copyOf(result);
  }

  /**
   * Removes the entry only if it still holds the given ticket.
   *
   * @param ticket ticket observed by the caller
   * @return {@code true} when the entry was removed
   */
  public boolean complete(Ticket ticket) {
    return tickets.remove(ticket.pointerId(), ticket.ticket());
  }

  public int size() {
    return tickets.size();
  }

  public void clear() {
    tickets.clear();
  }

  /**
   * Queue entry.
   *
   * @param pointerId queued pointer
   * @param ticket enqueue sequence number
   */
  public record Ticket(String pointerId, long ticket) {}
}
