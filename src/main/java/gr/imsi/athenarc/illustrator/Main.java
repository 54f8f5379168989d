package gr.imsi.athenarc.illustrator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.MapStylesheet;
import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.error.DiagramException;
import gr.imsi.athenarc.illustrator.io.DiagramJsonReader;
import gr.imsi.athenarc.illustrator.io.SceneJsonWriter;
import gr.imsi.athenarc.illustrator.lint.Diagnostic;
import gr.imsi.athenarc.illustrator.manager.RenderManager;
import gr.imsi.athenarc.illustrator.manager.RenderResult;
import gr.imsi.athenarc.illustrator.model.Diagram;
import gr.imsi.athenarc.illustrator.scene.Scene;
import gr.imsi.athenarc.illustrator.util.PointConverter;

/**
 * Command line host: reads a diagram as JSON, renders it and prints the scene.
 * Exit status is 1 when the render fails and 2 when {@code -lint} finds diagnostics.
 */
public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_DIAGNOSTICS = 2;

    @Parameter(names = "-input", description = "Diagram JSON file", required = true)
    private String input;

    @Parameter(names = "-stylesheet", description = "Stylesheet JSON file mapping symbolic colors to values")
    private String stylesheet;

    @Parameter(names = "-out", description = "Scene JSON output file (default: standard output)")
    private String out;

    @Parameter(names = "-config", description = "Layout properties file overriding the bundled defaults")
    private String config;

    @Parameter(names = "-origin", converter = PointConverter.class, description = "Top left corner of the diagram, as x,y")
    private Point origin;

    @Parameter(names = "-lint", description = "Report geometric defects on standard error as JSON lines")
    private boolean lint;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jCommander.usage();
            return EXIT_ERROR;
        }
        if (main.help) {
            jCommander.usage();
            return EXIT_OK;
        }
        try {
            return main.execute();
        } catch (IOException e) {
            LOG.error("Could not read or write diagram files", e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Malformed diagram or configuration: {}", e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int execute() throws IOException {
        DiagramJsonReader reader = new DiagramJsonReader();
        SceneJsonWriter writer = new SceneJsonWriter();
        Diagram diagram = reader.read(Paths.get(input));
        Stylesheet styles = stylesheet == null
                ? MapStylesheet.defaultPalette()
                : reader.readStylesheet(Paths.get(stylesheet));
        RenderManager manager = RenderManager.builder()
                .withLayoutConfig(layoutConfig())
                .build();

        Scene scene;
        RenderResult result = null;
        try {
            if (lint) {
                result = manager.validate(diagram, styles);
                scene = result.getScene();
            } else {
                scene = manager.render(diagram, styles);
            }
        } catch (DiagramException e) {
            System.err.println(writer.toJsonLine(e));
            LOG.error("Render failed in {} phase: {}", e.getPhase(), e.getMessage());
            return EXIT_ERROR;
        }

        if (out == null) {
            writer.write(scene, System.out);
            System.out.println();
            System.out.flush();
        } else {
            try (OutputStream stream = Files.newOutputStream(Paths.get(out))) {
                writer.write(scene, stream);
            }
        }

        if (result != null && result.hasDiagnostics()) {
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                System.err.println(writer.toJsonLine(diagnostic));
            }
            LOG.warn("{} geometric diagnostics in {}", result.getDiagnostics().size(), input);
            return EXIT_DIAGNOSTICS;
        }
        return EXIT_OK;
    }

    private LayoutConfig layoutConfig() throws IOException {
        Properties properties = readProperties();
        if (config != null) {
            Path path = Paths.get(config);
            try (InputStream in = Files.newInputStream(path)) {
                properties.load(in);
            }
        }
        if (origin != null) {
            properties.setProperty(LayoutConfig.PREFIX + "origin", origin.getX() + "," + origin.getY());
        }
        return LayoutConfig.fromProperties(properties);
    }

    public static Properties readProperties() throws IOException {
        Properties properties = new Properties();
        // "/illustrator.properties" is at src/main/resources/illustrator.properties
        try (InputStream input = Main.class.getResourceAsStream("/illustrator.properties")) {
            if (input == null) {
                LOG.warn("Unable to find illustrator.properties in resources, using built-in defaults");
                return properties;
            }
            properties.load(input);
        }
        return properties;
    }
}
