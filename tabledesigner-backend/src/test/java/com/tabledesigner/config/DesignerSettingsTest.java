package com.tabledesigner.config;

import com.tabledesigner.service.AlterationMode;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesignerSettingsTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        DesignerSettings settings = DesignerSettings.fromEnvironment(new MockEnvironment());

        assertThat(settings.databasePath()).isEqualTo("database_designer.db");
        assertThat(settings.designStorePath()).isEqualTo("design_storage.db");
        assertThat(settings.alterationMode()).isEqualTo(AlterationMode.REBUILD);
        assertThat(settings.preserveRows()).isFalse();
        assertThat(settings.maxRows()).isEqualTo(1000);
    }

    @Test
    void propertiesWinOverEnvironmentVariables() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("tabledesigner.database.path", " /data/live.db ")
                .withProperty("TABLEDESIGNER_DATABASE_PATH", "/ignored.db")
                .withProperty("TABLEDESIGNER_DESIGN_STORE_PATH", "/data/designs.db")
                .withProperty("tabledesigner.sync.mode", "in-place")
                .withProperty("TABLEDESIGNER_SYNC_PRESERVE_ROWS", "yes")
                .withProperty("tabledesigner.execute.max-rows", "50");

        DesignerSettings settings = DesignerSettings.fromEnvironment(env);

        assertThat(settings.databasePath()).isEqualTo("/data/live.db");
        assertThat(settings.designStorePath()).isEqualTo("/data/designs.db");
        assertThat(settings.alterationMode()).isEqualTo(AlterationMode.IN_PLACE);
        assertThat(settings.preserveRows()).isTrue();
        assertThat(settings.maxRows()).isEqualTo(50);
    }

    @Test
    void unparsableNumbersFallBackToDefaults() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("tabledesigner.pool.max-size", "many")
                .withProperty("tabledesigner.sync.preserve-rows", "perhaps");

        DesignerSettings settings = DesignerSettings.fromEnvironment(env);

        assertThat(settings.poolMaxSize()).isEqualTo(4);
        assertThat(settings.preserveRows()).isFalse();
    }

    @Test
    void unknownModeFailsStartup() {
        MockEnvironment env = new MockEnvironment().withProperty("tabledesigner.sync.mode", "sideways");

        assertThatThrownBy(() -> DesignerSettings.fromEnvironment(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tabledesigner.sync.mode");
    }
}
