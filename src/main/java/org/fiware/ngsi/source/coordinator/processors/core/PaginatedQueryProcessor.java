/**
 * @file PaginatedQueryProcessor.java
 * @brief paginated NGSI entity snapshot retrieval
 * @author Doug Anson
 * @version 1.0
 * @see
 *
 * Copyright 2015. ARM Ltd. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package org.fiware.ngsi.source.coordinator.processors.core;

import org.fiware.ngsi.source.coordinator.SourceConfiguration;
import org.fiware.ngsi.source.coordinator.processors.interfaces.EntitySink;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.ngsi.EntityPage;
import org.fiware.ngsi.source.ngsi.EntityQuery;
import org.fiware.ngsi.source.ngsi.NGSIConnection;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.concurrent.Executor;

/**
 * Paginated query processor: retrieves the current state of the matching entities page by page
 *
 * @author Doug Anson
 */
public class PaginatedQueryProcessor extends BaseClass {
    public static final int PAGE_SIZE = 100;            // entities per page
    public static final int MAX_PAGE_INDEX = 100;       // last page index requested (10,000 entity cap)
    public static final String FORMAT_KEY_VALUES = "keyValues";

    private final Executor m_continuation_executor;

    // constructor: page results are handled on the continuation executor
    public PaginatedQueryProcessor(ErrorLogger error_logger, PreferenceManager preference_manager, Executor continuation_executor) {
        super(error_logger, preference_manager);
        this.m_continuation_executor = continuation_executor;
    }

    /**
     * start the query sequence
     * @param connection NGSI connection
     * @param configuration filters and buffering mode
     * @param format "normalized" or "keyValues"
     * @param sink receives the entity batches
     * @return the cancellable task
     */
    public QueryTask start(NGSIConnection connection, SourceConfiguration configuration, String format, EntitySink sink) {
        QueryTask task = new QueryTask(format, configuration.buffering());
        this.fetchPage(connection, configuration, task, sink, 0);
        return task;
    }

    // request one page
    private void fetchPage(NGSIConnection connection, SourceConfiguration configuration, QueryTask task, EntitySink sink, int page) {
        if (task.isCancelled()) {
            return;
        }
        EntityQuery query = new EntityQuery()
                .idPattern(configuration.idPattern())
                .types(configuration.types())
                .q(configuration.query())
                .count(true)
                .keyValues(FORMAT_KEY_VALUES.equals(task.format()))
                .limit(PAGE_SIZE)
                .offset(page * PAGE_SIZE);
        task.pageRequested();
        connection.listEntities(query).whenCompleteAsync((result, ex) -> {
            if (ex != null) {
                this.pageFailed(task, ex);
            }
            else {
                this.pageReceived(connection, configuration, task, sink, page, result);
            }
        }, this.m_continuation_executor);
    }

    // handle a page
    private void pageReceived(NGSIConnection connection, SourceConfiguration configuration, QueryTask task, EntitySink sink, int page, EntityPage result) {
        // results of a cancelled task are discarded
        if (task.isCancelled()) {
            return;
        }
        if (task.isBuffering()) {
            task.buffer(result.results());
        }
        else {
            sink.entitiesReceived(task.format(), result.results());
        }
        if (page < MAX_PAGE_INDEX && (page + 1) * PAGE_SIZE < result.count()) {
            this.fetchPage(connection, configuration, task, sink, page + 1);
        }
        else {
            if (task.isBuffering() && !task.isCancelled()) {
                sink.entitiesReceived(task.format(), task.drainBuffer());
            }
            task.finished();
        }
    }

    // handle a failed page request
    private void pageFailed(QueryTask task, Throwable ex) {
        Throwable cause = NGSIConnection.unwrap(ex);
        if (!task.isCancelled()) {
            this.errorLogger().critical("Error retrieving initial values", cause);
        }
        task.failed(cause);
    }
}
