package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.server.spi.InMemoryModelPersistence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRegistryTest {

    private static final ActionHandler<Action> NOTHING = (ctx, action) -> CompletableFuture.completedFuture(List.of());

    @Test
    void duplicateKindIsRejected() {
        ActionRegistry.Builder builder = ActionRegistry.builder()
                .register(Action.RequestTools.KIND, Action.RequestTools.class, NOTHING);

        assertThatThrownBy(() -> builder.register(Action.RequestTools.KIND, Action.RequestTools.class, NOTHING))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestTools");
        assertThatThrownBy(() -> builder.register(" ", Action.RequestTools.class, NOTHING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void engineRegistersEveryClientKind() {
        ActionRegistry registry = DiagramSessionsEngine.builder(TestDiagrams.provider()).executor(Runnable::run).build().registry();

        assertThat(registry.kinds()).contains(
                Action.RequestModel.KIND, Action.RequestTools.KIND, Action.RequestLayers.KIND,
                Action.RequestTypeHints.KIND, Action.RequestEditValidation.KIND, Action.ComputedBounds.KIND,
                Action.ToggleLayer.KIND, Action.CreateNode.KIND, Action.CreateConnection.KIND,
                Action.DeleteElement.KIND, Action.ChangeBounds.KIND, Action.ChangeContainer.KIND,
                Action.ReconnectEdge.KIND, Action.ChangeRoutingPoints.KIND, Action.ApplyLabelEdit.KIND,
                Action.Select.KIND, Action.SelectAll.KIND, Action.SaveModel.KIND, Action.ExportSvg.KIND,
                Action.IdentifiableRequest.KIND, Action.IdentifiableResponse.KIND);
        assertThat(registry.kinds()).doesNotContain(Action.SetModel.KIND, Action.ServerStatus.KIND);
    }

    @Test
    void typeHintRequestReplacesTheSessionTable() {
        DiagramSessionsEngine engine = TestDiagrams.engine(new InMemoryModelPersistence()).build();

        TestDiagrams.send(engine, new Action.RequestTools());
        List<Action> out = TestDiagrams.send(engine, new Action.RequestTypeHints());

        assertThat(out).singleElement().isInstanceOfSatisfying(Action.SetTypeHints.class, hints -> {
            assertThat(hints.shapeHints()).contains(TestDiagrams.TASK, TestDiagrams.LANE);
            assertThat(hints.edgeHints()).containsExactly(TestDiagrams.FLOW);
        });
    }
}
