package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds the cheapest entry and exit on a boost corridor.
 *
 * <p>For corridor length {@code L} and minimum span {@code m} the solver minimizes
 * {@code d(O, entry)/v + d(entry, exit)/vBoost + d(exit, D)/v} over {@code 0 <= e < x <= L},
 * {@code x - e >= m}. The feasible triangle is mapped onto the unit square:</p>
 * <pre>
 *   e = u * (L - m)
 *   x = e + m + w * (L - m - e)      u, w in [0, 1]
 * </pre>
 * <p>so every point BOBYQA visits is feasible and only box bounds remain.</p>
 */
public final class CorridorSolver {
    private static final Logger log = LoggerFactory.getLogger(CorridorSolver.class);

    private static final double INITIAL_ENTRY_FRACTION = 0.33d;
    private static final double INITIAL_EXIT_FRACTION = 0.66d;
    private static final int INTERPOLATION_POINTS = 5;
    private static final double INITIAL_TRUST_RADIUS = 0.1d;
    private static final double STOPPING_TRUST_RADIUS = 1e-9d;

    private final BoostPolicy policy;

    public CorridorSolver(BoostPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Solves entry/exit for one corridor.
     *
     * @return the optimal traversal, or empty when the corridor is shorter than the minimum span
     *         or the optimizer does not converge within its evaluation budget.
     */
    public Optional<CorridorTraversal> solve(GeoPoint origin, GeoPoint destination, BoostCorridor corridor) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(corridor, "corridor");

        double length = corridor.lengthKm();
        double minSpan = policy.getMinSpanKm();
        if (length < minSpan) {
            return Optional.empty();
        }

        MultivariateFunction objective = params -> {
            double[] ex = toEntryExit(params[0], params[1], length, minSpan);
            return weightedTime(origin, destination, corridor.pointAt(ex[0]), corridor.pointAt(ex[1]));
        };

        double[] start = initialGuess(length, minSpan);
        PointValuePair optimum;
        try {
            optimum = new BOBYQAOptimizer(INTERPOLATION_POINTS, INITIAL_TRUST_RADIUS, STOPPING_TRUST_RADIUS).optimize(
                    new MaxEval(policy.getSolverMaxEvaluations()),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new SimpleBounds(new double[]{0.0d, 0.0d}, new double[]{1.0d, 1.0d})
            );
        } catch (MathIllegalStateException ex) {
            log.debug("Corridor solve did not converge (length {} km): {}", length, ex.getMessage());
            return Optional.empty();
        }

        double[] point = optimum.getPoint();
        double[] ex = toEntryExit(point[0], point[1], length, minSpan);
        GeoPoint entry = corridor.pointAt(ex[0]);
        GeoPoint exit = corridor.pointAt(ex[1]);
        double cost = weightedTime(origin, destination, entry, exit);
        if (!Double.isFinite(cost) || !Double.isFinite(ex[0]) || !Double.isFinite(ex[1])) {
            log.debug("Corridor solve produced a non-finite result (length {} km)", length);
            return Optional.empty();
        }
        return Optional.of(new CorridorTraversal(ex[0], ex[1], entry, exit, cost));
    }

    /**
     * Speed-weighted cost of flying origin, entry, exit, destination.
     */
    public double weightedTime(GeoPoint origin, GeoPoint destination, GeoPoint entry, GeoPoint exit) {
        return GreatCircle.distanceKm(origin, entry) / policy.getNormalSpeed()
                + GreatCircle.distanceKm(entry, exit) / policy.getBoostSpeed()
                + GreatCircle.distanceKm(exit, destination) / policy.getNormalSpeed();
    }

    /**
     * Maps unit-square parameters to {@code (entry, exit)} distances along the corridor.
     */
    static double[] toEntryExit(double u, double w, double length, double minSpan) {
        double entry = clampUnit(u) * (length - minSpan);
        double exit = entry + minSpan + clampUnit(w) * (length - minSpan - entry);
        return new double[]{entry, exit};
    }

    /**
     * Unit-square image of entering at 33% and leaving at 66% of the corridor.
     */
    static double[] initialGuess(double length, double minSpan) {
        double entry = INITIAL_ENTRY_FRACTION * length;
        double exit = INITIAL_EXIT_FRACTION * length;
        double entryRange = length - minSpan;
        double u = entryRange > 0.0d ? clampUnit(entry / entryRange) : 0.0d;
        double clampedEntry = u * entryRange;
        double exitRange = length - minSpan - clampedEntry;
        double w = exitRange > 0.0d ? clampUnit((exit - clampedEntry - minSpan) / exitRange) : 0.0d;
        return new double[]{u, w};
    }

    private static double clampUnit(double value) {
        if (value < 0.0d) {
            return 0.0d;
        }
        if (value > 1.0d) {
            return 1.0d;
        }
        return value;
    }
}
