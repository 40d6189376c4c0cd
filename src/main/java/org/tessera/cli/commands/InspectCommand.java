package org.tessera.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.tessera.cli.CommandLineInterface;
import org.tessera.crs.CrsRegistry;
import org.tessera.pipeline.MosaicEngineFactory;
import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.tessera.scene.GranuleSceneLoader;
import org.tessera.scene.Scene;
import org.tessera.scene.SceneCatalog;
import org.tessera.scene.SceneReadException;
import org.tessera.scene.SceneSelector;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists level-2A scenes and, given an output tile, which of them a mosaic would use. Reads metadata only.
 */
@Command(
    name = "inspect",
    description = "List level-2A scenes and their selection for an output tile"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(
        paramLabel = "PATH",
        arity = "0..*",
        description = "Granule directories, .SAFE products, directories containing them, or text files listing them (default: working directory)"
    )
    private List<Path> inputs;

    @Option(
        names = {"-te", "--target-extent"},
        arity = "4",
        paramLabel = "COORD",
        description = "Output tile extent: XMIN YMIN XMAX YMAX in the output CRS"
    )
    private double[] targetExtent;

    @Option(
        names = {"-e", "--epsg"},
        description = "EPSG code of the output CRS (required with --target-extent)"
    )
    private Integer epsg;

    @Option(
        names = {"-r", "--resolution"},
        defaultValue = "20",
        description = "Resolution whose geometry is inspected: 10, 20 or 60 (default: ${DEFAULT-VALUE})"
    )
    private int resolution;

    @Option(
        names = {"-st", "--start"},
        paramLabel = "YYYYMMDD",
        description = "First acquisition date to include"
    )
    private String start;

    @Option(
        names = {"-en", "--end"},
        paramLabel = "YYYYMMDD",
        description = "Last acquisition date to include"
    )
    private String end;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (resolution != 10 && resolution != 20 && resolution != 60) {
                throw new IllegalArgumentException("Resolution must be 10, 20 or 60, got " + resolution);
            }
            if ((targetExtent == null) != (epsg == null)) {
                throw new IllegalArgumentException("--target-extent and --epsg must be given together");
            }
            MosaicEngineFactory factory = new MosaicEngineFactory(parent.getConfig());
            Grid grid = null;
            if (targetExtent != null) {
                String crs = CrsRegistry.epsgCode(epsg);
                if (!factory.crsRegistry().isKnown(crs)) {
                    throw new IllegalArgumentException("Unknown EPSG code: " + epsg);
                }
                grid = Grid.of(Extent.of(targetExtent), resolution, crs);
            }
            LocalDate startDate = start != null ? MosaicCommand.parseDate(start, "--start") : null;
            LocalDate endDate = end != null ? MosaicCommand.parseDate(end, "--end") : null;

            List<Path> granules = SceneCatalog.findGranules(
                inputs == null || inputs.isEmpty() ? List.of(Path.of(".")) : inputs, "L2A");
            GranuleSceneLoader loader = factory.sceneLoader();
            List<Scene> scenes = new ArrayList<>();
            for (Path granule : granules) {
                try {
                    scenes.add(loader.load(granule, resolution));
                } catch (SceneReadException e) {
                    err.printf("Unreadable granule %s: %s%n", granule.getFileName(), e.getMessage());
                }
            }
            scenes.sort(SceneSelector.PROCESSING_ORDER);

            Set<String> selected = new HashSet<>();
            if (grid != null) {
                for (Scene scene : factory.sceneSelector().select(scenes, grid, startDate, endDate)) {
                    selected.add(scene.id());
                }
            }

            out.printf("%-6s  %-20s  %-11s  %7s  %-8s  %s%n", "TILE", "SENSED", "CRS", "NODATA", "SELECTED", "GRANULE");
            for (Scene scene : scenes) {
                out.printf("%-6s  %-20s  %-11s  %6.1f%%  %-8s  %s%n",
                    scene.tileId(),
                    scene.acquisitionTime(),
                    scene.crs(),
                    scene.nodataFraction() * 100,
                    grid == null ? "-" : (selected.contains(scene.id()) ? "yes" : "no"),
                    scene.id());
            }
            out.printf("%n%d scenes", scenes.size());
            if (grid != null) {
                out.printf(", %d selected for %s", selected.size(), grid);
            }
            out.println();
            return 0;
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
