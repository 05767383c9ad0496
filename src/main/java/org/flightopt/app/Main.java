package org.flightopt.app;

import org.flightopt.io.CsvLegSource;
import org.flightopt.routing.core.RankedRoute;
import org.flightopt.routing.core.RouteCore;
import org.flightopt.routing.core.RouteCoreException;
import org.flightopt.routing.core.RoutePlanResponse;
import org.flightopt.routing.core.RouteRequest;
import org.flightopt.routing.cost.PreferenceScale;
import org.flightopt.routing.cost.WeightVector;
import org.flightopt.routing.graph.InvalidLegRecordException;
import org.flightopt.routing.graph.LegGraph;
import org.flightopt.routing.graph.LegGraphLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line route optimizer.
 *
 * <pre>
 * Main &lt;flights.csv&gt; &lt;source&gt; &lt;destination&gt; [cost time layover co2] [limit]
 * </pre>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_NO_ROUTE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INVALID_INPUT = 3;

    // no [limit] argument: use the configured default
    private static final int NO_LIMIT = -1;

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String USAGE =
            "usage: Main <flights.csv> <source> <destination> [cost time layover co2] [limit]";

    /**
     * Runs one query and exits with its status code.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs one query, printing ranked routes to {@code out}.
     *
     * @return process exit code.
     */
    static int run(String[] args, PrintStream out) {
        if (args.length != 3 && args.length != 4 && args.length != 7 && args.length != 8) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        PreferenceScale scale = PreferenceScale.defaults();
        WeightVector weights;
        int limit;
        try {
            weights = args.length >= 7
                    ? scale.toWeightVector(
                            Integer.parseInt(args[3]),
                            Integer.parseInt(args[4]),
                            Integer.parseInt(args[5]),
                            Integer.parseInt(args[6]))
                    : scale.defaultWeights();
            limit = NO_LIMIT;
            if (args.length == 4 || args.length == 8) {
                limit = Integer.parseInt(args[args.length - 1]);
                if (limit < 0) {
                    throw new IllegalArgumentException("limit must be >= 0, got " + limit);
                }
            }
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        LegGraph graph;
        try {
            graph = LegGraphLoader.load(new CsvLegSource().read(Path.of(args[0])));
        } catch (IOException | InvalidLegRecordException ex) {
            LOG.error("Cannot load flight table {}", args[0], ex);
            out.println("Cannot load flight table: " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }

        RouteCore core = RouteCore.of(graph);
        RouteRequest request = RouteRequest.builder()
                .sourceAirport(args[1])
                .targetAirport(args[2])
                .weights(weights)
                .build();
        try {
            RoutePlanResponse response = limit == NO_LIMIT ? core.plan(request) : core.plan(request, limit);
            for (RankedRoute route : response.getRoutes()) {
                out.println(route);
            }
            LOG.info("Printed {} routes for {} -> {}", response.getRoutes().size(), args[1], args[2]);
            return EXIT_OK;
        } catch (RouteCoreException ex) {
            out.println(ex.getMessage());
            if (RouteCore.REASON_NO_PATH_FOUND.equals(ex.getReasonCode())) {
                out.println("No valid path found between selected airports.");
                return EXIT_NO_ROUTE;
            }
            return EXIT_INVALID_INPUT;
        }
    }
}
