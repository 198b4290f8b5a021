package me.golemcore.costmodel.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.costmodel.domain.exception.QueryException;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, thread-safe collection of query failures for one batch.
 *
 * <p>
 * Any number of tasks may {@link #report} concurrently. Reads are only
 * meaningful once every producer has finished, i.e. after the batch barrier
 * has released.
 */
public class ErrorCollector {

    private final List<QueryException> errors = new ArrayList<>();

    /**
     * Record an error. {@code null} is ignored.
     */
    public void report(QueryException error) {
        if (error == null) {
            return;
        }
        synchronized (errors) {
            errors.add(error);
        }
    }

    public boolean isEmpty() {
        synchronized (errors) {
            return errors.isEmpty();
        }
    }

    /**
     * Snapshot of all reported errors in report order.
     */
    public List<QueryException> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public List<QueryException> errorsFor(String queryName) {
        return getErrors().stream()
                .filter(e -> queryName.equals(e.getQueryName()))
                .toList();
    }
}
