/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.decider.jooq;

import io.github.suppierk.decider.exception.ConcurrencyConflictException;
import io.github.suppierk.decider.store.Store;
import io.github.suppierk.decider.store.Versioned;
import java.io.Serializable;
import java.util.Map;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Store} keeping one row per aggregate in a relational table.
 *
 * <p>The table must have a primary key column for the identifier and a {@code BIGINT} column for
 * the version. Compare-and-swap is expressed with plain SQL:
 *
 * <ul>
 *   <li>Expected version {@link Versioned#ABSENT_VERSION} inserts the row, so that the primary key
 *       rejects a concurrent insert of the same identifier.
 *   <li>Any other expected version updates the row only where the version still matches.
 * </ul>
 *
 * <p>Each write is a single statement and relies on the auto-commit mode of the {@link DSLContext}
 * connection, or on the transaction the caller already runs it in.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <RECORD> the type of the stored record
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class JooqStore<ID extends Serializable, RECORD> implements Store<ID, RECORD> {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqStore.class);

  /** SQLSTATE reported by PostgreSQL and H2 when a primary or unique key is duplicated. */
  private static final String UNIQUE_VIOLATION = "23505";

  private final DSLContext dsl;
  private final Table<Record> table;
  private final Field<ID> idField;
  private final Field<Long> versionField;

  /**
   * Default constructor.
   *
   * @param dsl to run statements with
   * @param table to keep records in
   * @param idField primary key column
   * @param versionField version column
   * @throws IllegalArgumentException if any argument is null
   */
  protected JooqStore(
      final DSLContext dsl,
      final Table<Record> table,
      final Field<ID> idField,
      final Field<Long> versionField) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null");
    }

    if (idField == null) {
      throw new IllegalArgumentException("Identifier field cannot be null");
    }

    if (versionField == null) {
      throw new IllegalArgumentException("Version field cannot be null");
    }

    this.dsl = dsl;
    this.table = table;
    this.idField = idField;
    this.versionField = versionField;
  }

  /**
   * Maps the record to the columns it occupies, excluding identifier and version.
   *
   * @param record to map
   * @return column values to insert or update
   */
  protected abstract Map<Field<?>, Object> toFields(final RECORD record);

  /**
   * Maps the fetched row back to the record.
   *
   * @param databaseRecord row fetched from the table
   * @return the record
   */
  protected abstract RECORD fromDatabaseRecord(final Record databaseRecord);

  /** {@inheritDoc} */
  @Override
  public Optional<Versioned<RECORD>> find(final ID id) {
    if (id == null) {
      throw new IllegalArgumentException("Identifier cannot be null");
    }

    return dsl.selectFrom(table)
        .where(idField.eq(id))
        .fetchOptional()
        .map(row -> new Versioned<>(fromDatabaseRecord(row), row.get(versionField)));
  }

  /** {@inheritDoc} */
  @Override
  public Versioned<RECORD> upsert(final ID id, final RECORD record, final long expectedVersion) {
    if (id == null) {
      throw new IllegalArgumentException("Identifier cannot be null");
    }

    if (record == null) {
      throw new IllegalArgumentException("Record cannot be null");
    }

    if (expectedVersion == Versioned.ABSENT_VERSION) {
      insert(id, record);
    } else {
      update(id, record, expectedVersion);
    }

    final long version = expectedVersion + 1;
    LOGGER.debug("Stored '{}' in '{}' at version {}", id, table.getName(), version);
    return new Versioned<>(record, version);
  }

  private void insert(final ID id, final RECORD record) {
    try {
      dsl.insertInto(table)
          .set(idField, id)
          .set(toFields(record))
          .set(versionField, Versioned.FIRST_VERSION)
          .execute();
    } catch (DataAccessException e) {
      if (UNIQUE_VIOLATION.equals(e.sqlState())) {
        throw new ConcurrencyConflictException(
            id, "Aggregate '%s' was created concurrently".formatted(id), e);
      }

      throw e;
    }
  }

  private void update(final ID id, final RECORD record, final long expectedVersion) {
    final int updated =
        dsl.update(table)
            .set(toFields(record))
            .set(versionField, expectedVersion + 1)
            .where(idField.eq(id))
            .and(versionField.eq(expectedVersion))
            .execute();

    if (updated == 0) {
      throw new ConcurrencyConflictException(id, expectedVersion);
    }
  }
}
