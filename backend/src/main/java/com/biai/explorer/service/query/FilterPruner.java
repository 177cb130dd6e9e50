package com.biai.explorer.service.query;

import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.TableMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes filter leaves that reference columns the target table does not have.
 * Logical nodes left without children are removed as well.
 */
@Slf4j
@Component
public class FilterPruner {

    public Optional<Filter> prune(Filter filter, TableMetadata table) {
        if (filter == null) {
            return Optional.empty();
        }
        return filter.accept(new Pruning(table));
    }

    private final class Pruning implements Filter.Visitor<Optional<Filter>> {

        private final TableMetadata table;

        private Pruning(TableMetadata table) {
            this.table = table;
        }

        @Override
        public Optional<Filter> visitCondition(Filter.Condition condition) {
            if (!condition.isComplete()) {
                return Optional.empty();
            }
            if (!table.hasColumn(condition.column())) {
                log.warn("Dropping filter on unknown column '{}' of table {}", condition.column(), table.tableName());
                return Optional.empty();
            }
            String reference = condition.temporalReferenceColumn();
            if (reference != null && !table.hasColumn(reference)) {
                log.warn("Dropping filter on unknown reference column '{}' of table {}", reference, table.tableName());
                return Optional.empty();
            }
            return Optional.of(condition);
        }

        @Override
        public Optional<Filter> visitAnd(Filter.And and) {
            List<Filter> kept = pruneAll(and.filters());
            return kept.isEmpty() ? Optional.empty() : Optional.of(new Filter.And(kept, and.tableName()));
        }

        @Override
        public Optional<Filter> visitOr(Filter.Or or) {
            List<Filter> kept = pruneAll(or.filters());
            return kept.isEmpty() ? Optional.empty() : Optional.of(new Filter.Or(kept, or.tableName()));
        }

        @Override
        public Optional<Filter> visitNot(Filter.Not not) {
            return prune(not.filter(), table).map(inner -> new Filter.Not(inner, not.tableName()));
        }

        private List<Filter> pruneAll(List<Filter> filters) {
            List<Filter> kept = new ArrayList<>();
            for (Filter child : filters) {
                prune(child, table).ifPresent(kept::add);
            }
            return kept;
        }
    }
}
