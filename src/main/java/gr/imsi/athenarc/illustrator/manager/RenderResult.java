package gr.imsi.athenarc.illustrator.manager;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.lint.Diagnostic;
import gr.imsi.athenarc.illustrator.scene.Scene;

/**
 * A scene together with the advisory diagnostics found in it.
 */
public final class RenderResult {

    private final Scene scene;
    private final ImmutableList<Diagnostic> diagnostics;

    public RenderResult(Scene scene, List<Diagnostic> diagnostics) {
        this.scene = scene;
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public Scene getScene() {
        return scene;
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
