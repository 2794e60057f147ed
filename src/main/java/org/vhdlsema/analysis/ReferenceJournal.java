/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.vhdlsema.analysis;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.vhdlsema.ast.Reference;

/**
 * Records every reference binding made during analysis so that a speculative pass can be undone.
 *
 * <p>Transactions nest, and each one is closed by a {@link #rollback} that undoes every binding
 * made since the matching {@link #begin}. Outside any transaction bindings are permanent and are
 * not recorded.
 */
final class ReferenceJournal {

  /** One undoable binding: the reference and the value it held before. */
  private static final class Entry {
    final Reference reference;
    final int previous;

    Entry(Reference reference, int previous) {
      this.reference = reference;
      this.previous = previous;
    }
  }

  private final List<Entry> entries = new ArrayList<>();

  /** For each open transaction, the size of {@link #entries} when it began. */
  private final List<Integer> marks = new ArrayList<>();

  /** Binds {@code reference} to {@code declaration}, recording it if a transaction is open. */
  void bind(Reference reference, Declaration declaration) {
    int previous = reference.get();
    reference.setUnique(declaration.id);
    if (!marks.isEmpty() && previous != declaration.id) {
      entries.add(new Entry(reference, previous));
    }
  }

  void begin() {
    marks.add(entries.size());
  }

  /** Undoes the bindings of the innermost open transaction, most recent first, and closes it. */
  void rollback() {
    Preconditions.checkState(!marks.isEmpty(), "No open transaction");
    int mark = marks.remove(marks.size() - 1);
    for (int i = entries.size() - 1; i >= mark; i--) {
      Entry entry = entries.remove(i);
      entry.reference.reset(entry.previous);
    }
  }
}
