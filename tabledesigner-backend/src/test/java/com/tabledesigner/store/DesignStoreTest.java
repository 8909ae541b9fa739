package com.tabledesigner.store;

import com.tabledesigner.error.DesignNotFoundException;
import com.tabledesigner.model.DesignRecord;
import com.tabledesigner.model.DesignSummary;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;
import com.tabledesigner.support.DesignerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.tabledesigner.support.DesignerFixture.field;
import static com.tabledesigner.support.DesignerFixture.usersDesign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesignStoreTest {

    @TempDir
    Path tempDir;

    private DesignerFixture fixture;
    private DesignStore store;

    @BeforeEach
    void setUp() throws Exception {
        fixture = DesignerFixture.create(tempDir);
        store = fixture.designStore;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void putThenGetReturnsFullDesign() {
        TableDesign design = usersDesign();
        design.setComment("registered users");
        FieldSpec age = field("age", "INTEGER");
        age.setDefaultValue("0");
        List<FieldSpec> fields = new ArrayList<>(design.getFields());
        fields.add(age);
        design.setFields(fields);

        store.put(design);
        DesignRecord record = store.get("users").orElseThrow();

        assertThat(record.getVersion()).isEqualTo(1);
        assertThat(record.getDesign()).isEqualTo(design);
        assertThat(record.getDesign().findField("age").orElseThrow().getDefaultValue()).isEqualTo("0");
        assertThat(record.getCreatedAt()).isEqualTo(record.getUpdatedAt());
    }

    @Test
    void putReplacesRecordAndBumpsVersion() {
        DesignRecord first = store.put(usersDesign());
        TableDesign changed = new TableDesign("users", List.of(field("id", "INTEGER")));

        DesignRecord second = store.put(changed);

        assertThat(second.getVersion()).isEqualTo(2);
        assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(second.getUpdatedAt()).isAfterOrEqualTo(first.getUpdatedAt());
        assertThat(store.require("users").getDesign().getFields()).hasSize(1);
        assertThat(second).isEqualTo(store.require("users"));
    }

    @Test
    void lookupsIgnoreCase() {
        store.put(usersDesign());

        assertThat(store.get("USERS")).isPresent();
        assertThat(store.delete("Users")).isTrue();
        assertThat(store.get("users")).isEmpty();
    }

    @Test
    void requireFailsForUnknownTable() {
        assertThatThrownBy(() -> store.require("missing")).isInstanceOf(DesignNotFoundException.class);
        assertThat(store.delete("missing")).isFalse();
    }

    @Test
    void listsSummariesByTableName() {
        TableDesign orders = new TableDesign("orders", List.of(field("id", "INTEGER"), field("total", "REAL")));
        orders.setComment("customer orders");
        store.put(usersDesign());
        store.put(orders);

        List<DesignSummary> summaries = store.list();

        assertThat(summaries).extracting(DesignSummary::getTableName).containsExactly("orders", "users");
        assertThat(summaries.get(0).getFieldCount()).isEqualTo(2);
        assertThat(summaries.get(0).getComment()).isEqualTo("customer orders");
    }

    @Test
    void putFailsWhenStoreIsUnavailable() {
        store.put(usersDesign());
        fixture.designDataSource.close();

        assertThatThrownBy(() -> store.put(new TableDesign("users", List.of(field("x", "TEXT")))))
                .isInstanceOf(DesignStoreException.class);
    }

    @Test
    void commentsAreBestEffort() {
        fixture.commentStore.save("users", "people");
        assertThat(fixture.commentStore.find("USERS")).contains("people");

        fixture.designDataSource.close();
        fixture.commentStore.save("users", "ignored");
        assertThat(fixture.commentStore.find("users")).isEmpty();
    }
}
