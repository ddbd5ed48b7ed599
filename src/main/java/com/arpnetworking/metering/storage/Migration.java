/*
 * Copyright 2024 Inscope Metrics
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
package com.arpnetworking.metering.storage;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * One step of the store structure. Steps are applied in version order and
 * none may be skipped.
 *
 * @author Inscope Metrics
 */
public final class Migration {

    /**
     * Public constructor.
     *
     * @param version the version the store is at once the step completes
     * @param description a short description of the step
     * @param statements the DDL statements of the step
     */
    public Migration(final int version, final String description, final ImmutableList<String> statements) {
        _version = version;
        _description = description;
        _statements = statements;
    }

    public int getVersion() {
        return _version;
    }

    public String getDescription() {
        return _description;
    }

    public ImmutableList<String> getStatements() {
        return _statements;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Version", _version)
                .add("Description", _description)
                .toString();
    }

    private final int _version;
    private final String _description;
    private final ImmutableList<String> _statements;

    /**
     * The migrations known to this code, in order.
     */
    public static final ImmutableList<Migration> CHAIN = ImmutableList.of(
            new Migration(
                    1,
                    "version marker, series and data tables",
                    ImmutableList.of(
                            "create table schema_version (current_version integer not null)",
                            "create table series ("
                                    + "id bigint generated by default as identity primary key, "
                                    + "period_seconds bigint not null, "
                                    + "epoch timestamp with time zone not null, "
                                    + "ts_type varchar(10) not null, "
                                    + "get_limit integer not null)",
                            "create table series_data ("
                                    + "series_id bigint not null references series (id) on delete cascade, "
                                    + "stamp timestamp with time zone not null, "
                                    + "ingest timestamp with time zone not null, "
                                    + "data_value double precision not null, "
                                    + "primary key (series_id, stamp))")),
            new Migration(
                    2,
                    "descriptive series metadata",
                    ImmutableList.of(
                            "alter table series add column name varchar(255) default '' not null",
                            "alter table series add column description varchar(4000) default '' not null",
                            "alter table series add column unit varchar(64) default '' not null")),
            new Migration(
                    3,
                    "positive period and limit, crosstab index",
                    ImmutableList.of(
                            "alter table series add constraint series_period_positive check (period_seconds > 0)",
                            "alter table series add constraint series_get_limit_positive check (get_limit > 0)",
                            "create index series_data_stamp_idx on series_data (stamp, series_id)")));
}
