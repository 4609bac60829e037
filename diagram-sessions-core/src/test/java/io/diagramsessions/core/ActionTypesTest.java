package io.diagramsessions.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionTypesTest {

    @Test
    void defaultsResolveEveryBuiltInKind() {
        ActionTypes types = ActionTypes.defaults();

        assertThat(types.find("requestModel")).contains(Action.RequestModel.class);
        assertThat(types.find("identifiableResponseAction")).contains(Action.IdentifiableResponse.class);
        assertThat(types.find("serverStatus")).contains(Action.ServerStatus.class);
        assertThat(types.find(null)).isEmpty();
        assertThat(types.contains("fitToScreen")).isFalse();
    }

    @Test
    void registeringAKindTwiceFails() {
        ActionTypes.Builder builder = ActionTypes.builder().registerAll(ActionTypes.defaults());

        assertThatThrownBy(() -> builder.register(Action.SetModel.KIND, Action.SetModel.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("setModel");
        assertThatThrownBy(() -> builder.register("", Action.SetModel.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void extendedTablesKeepRegistrationOrder() {
        ActionTypes types = ActionTypes.builder()
                .register(Action.ToggleLayer.KIND, Action.ToggleLayer.class)
                .register(Action.RequestTools.KIND, Action.RequestTools.class)
                .build();

        assertThat(types.kinds()).containsExactly("toggleLayer", "requestTools");
    }
}
