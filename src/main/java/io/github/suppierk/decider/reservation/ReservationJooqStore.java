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

package io.github.suppierk.decider.reservation;

import io.github.suppierk.decider.jooq.JooqStore;
import java.util.Map;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Keeps {@link ReservationRecord}s in the {@code reservation} table:
 *
 * <pre>{@code
 * CREATE TABLE reservation (
 *   id      UUID PRIMARY KEY,
 *   number  VARCHAR NOT NULL,
 *   status  VARCHAR NOT NULL,
 *   version BIGINT  NOT NULL
 * );
 * }</pre>
 */
public final class ReservationJooqStore extends JooqStore<UUID, ReservationRecord> {
  public static final Table<Record> RESERVATION = DSL.table(DSL.name("reservation"));
  public static final Field<UUID> ID = DSL.field(DSL.name("id"), SQLDataType.UUID);
  public static final Field<String> NUMBER = DSL.field(DSL.name("number"), SQLDataType.VARCHAR);
  public static final Field<String> STATUS = DSL.field(DSL.name("status"), SQLDataType.VARCHAR);
  public static final Field<Long> VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);

  /**
   * @param dsl to run statements with
   * @throws IllegalArgumentException if dsl is null
   */
  public ReservationJooqStore(final DSLContext dsl) {
    super(dsl, RESERVATION, ID, VERSION);
  }

  @Override
  protected Map<Field<?>, Object> toFields(final ReservationRecord record) {
    return Map.of(NUMBER, record.number(), STATUS, record.status().name());
  }

  @Override
  protected ReservationRecord fromDatabaseRecord(final Record databaseRecord) {
    return new ReservationRecord(
        databaseRecord.get(ID),
        databaseRecord.get(NUMBER),
        ReservationStatus.valueOf(databaseRecord.get(STATUS)));
  }
}
