package com.rms.cdc.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.rms.cdc.core.ChangeFixtures;
import com.rms.cdc.core.filter.ColumnFilterEvaluator;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ColumnFilter;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.FilterOperator;
import com.rms.cdc.core.model.FilterValue;
import com.rms.cdc.core.model.MessageKind;
import com.rms.cdc.core.model.SourceTable;

class ConsumerMatcherTest {

    private final ConsumerMatcher matcher = new ConsumerMatcher(new ColumnFilterEvaluator());

    private final Change change = ChangeFixtures.insert(1, "test");

    @Test
    void unfilteredSourceTableMatchesEveryChangeOfThatTable() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        assertThat(matcher.matches(consumer, change)).isTrue();
    }

    @Test
    void otherTablesDoNotMatch() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(99L));

        assertThat(matcher.matches(consumer, change)).isFalse();
    }

    @Test
    void consumerWithoutSourceTablesMatchesNothing() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event);

        assertThat(matcher.matches(consumer, change)).isFalse();
    }

    @Test
    void allFiltersMustPass() {
        SourceTable table = new SourceTable(ChangeFixtures.ORDERS_OID, List.of(
                new ColumnFilter(2, FilterOperator.EQ, FilterValue.string("test")),
                new ColumnFilter(3, FilterOperator.GT, FilterValue.number(100))));
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, table);

        assertThat(matcher.matches(consumer, change)).isFalse();
    }

    @Test
    void filterOnNameSelectsMatchingRows() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, ChangeFixtures.nameEquals("test"));

        assertThat(matcher.matches(consumer, change)).isTrue();
        assertThat(matcher.matches(consumer, ChangeFixtures.insert(2, "not_test"))).isFalse();
    }

    @Test
    void firstSourceTableForAnOidDecides() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event,
                ChangeFixtures.nameEquals("other"),
                SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        assertThat(matcher.matches(consumer, change)).isFalse();
    }
}
