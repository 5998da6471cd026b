package com.restschema.server.demo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Thread-safe in-memory storage for {@link Cat}s. Callers only ever receive copies, so a
 * returned cat can be encoded while another request modifies the stored one.
 */
public class CatStore {
  private final TreeMap<Integer, Cat> cats = new TreeMap<>();
  private int lastId;

  /** Creates a cat, letting {@code initializer} fill in its attributes before an id is assigned. */
  public synchronized Cat create(Consumer<Cat> initializer) {
    Cat cat = new Cat();
    initializer.accept(cat);
    cat.setId(++lastId);
    cats.put(cat.getId(), cat);
    return cat.copy();
  }

  public synchronized Optional<Cat> get(int id) {
    return Optional.ofNullable(cats.get(id)).map(Cat::copy);
  }

  /**
   * Lists cats in id order.
   *
   * @param breeds breeds to keep, matched case-insensitively; empty keeps every cat
   * @param offset number of matching cats to skip
   * @param limit largest number of cats to return
   */
  public synchronized List<Cat> list(Collection<String> breeds, int offset, int limit) {
    List<String> wanted = new ArrayList<>();
    breeds.forEach(breed -> wanted.add(breed.toLowerCase(Locale.ROOT)));
    List<Cat> page = new ArrayList<>();
    int skipped = 0;
    for (Cat cat : cats.values()) {
      if (!wanted.isEmpty()
          && (cat.getBreed() == null || !wanted.contains(cat.getBreed().toLowerCase(Locale.ROOT)))) {
        continue;
      }
      if (skipped++ < offset) {
        continue;
      }
      if (page.size() == limit) {
        break;
      }
      page.add(cat.copy());
    }
    return page;
  }

  /** Replaces every attribute of a cat, keeping its id. */
  public synchronized Optional<Cat> replace(int id, Consumer<Cat> initializer) {
    if (!cats.containsKey(id)) {
      return Optional.empty();
    }
    Cat cat = new Cat();
    initializer.accept(cat);
    cat.setId(id);
    cats.put(id, cat);
    return Optional.of(cat.copy());
  }

  /** Applies {@code mutation} to a stored cat. */
  public synchronized Optional<Cat> update(int id, Consumer<Cat> mutation) {
    Cat cat = cats.get(id);
    if (cat == null) {
      return Optional.empty();
    }
    Cat updated = cat.copy();
    mutation.accept(updated);
    updated.setId(id);
    cats.put(id, updated);
    return Optional.of(updated.copy());
  }

  public synchronized boolean delete(int id) {
    return cats.remove(id) != null;
  }

  public synchronized int size() {
    return cats.size();
  }
}
