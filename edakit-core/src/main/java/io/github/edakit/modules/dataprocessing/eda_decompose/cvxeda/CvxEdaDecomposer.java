/*
 * Copyright (c) 2025 The edakit Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda;

import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionParameters;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import io.github.edakit.util.exceptions.SolverBackendUnavailableException;
import io.github.edakit.util.exceptions.SolverFailureException;
import io.github.edakit.util.optimization.ConvexSolverBackend;
import io.github.edakit.util.optimization.ConvexSolverBackends;
import io.github.edakit.util.optimization.SolverOptions;
import io.github.edakit.util.optimization.SolverResult;
import io.github.edakit.util.optimization.SolverStatus;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * cvxEDA decomposition (Greco, Valenza, Lanata, Scilingo and Citi, 2016).
 * <p>
 * The solver backend is looked up on every call, before any matrix is built, so a missing backend
 * only matters when this method is actually used.
 */
public class CvxEdaDecomposer implements EdaDecomposer {

  private static final Logger logger = Logger.getLogger(CvxEdaDecomposer.class.getName());

  private final EdaDecompositionParameters params;
  private final Supplier<Optional<ConvexSolverBackend>> backendLookup;

  public CvxEdaDecomposer() {
    this(EdaDecompositionParameters.DEFAULT);
  }

  public CvxEdaDecomposer(@NotNull EdaDecompositionParameters params) {
    this(params, ConvexSolverBackends::lookup);
  }

  public CvxEdaDecomposer(@NotNull EdaDecompositionParameters params,
      @NotNull Supplier<Optional<ConvexSolverBackend>> backendLookup) {
    this.params = params;
    this.backendLookup = backendLookup;
  }

  @Override
  public @NotNull String getName() {
    return "cvxEDA";
  }

  @Override
  public @NotNull EdaDecompositionResult decompose(double[] signal, int samplingRate) {
    return decomposeFull(signal, samplingRate).toDecompositionResult();
  }

  /**
   * @throws SolverBackendUnavailableException if no {@link ConvexSolverBackend} is registered
   * @throws SolverFailureException            if the solver returns neither an optimal nor a
   *                                           near-optimal solution
   * @throws IllegalArgumentException          for invalid time constants or knot spacing
   */
  public @NotNull CvxEdaResult decomposeFull(double[] signal, int samplingRate) {
    final ConvexSolverBackend backend = backendLookup.get().orElseThrow(
        () -> new SolverBackendUnavailableException(
            "cvxEDA needs a convex solver backend, but none is registered as "
                + ConvexSolverBackend.class.getName() + " service"));

    final BatemanArmaModel model = new BatemanArmaModel(params.tau0(), params.tau1(),
        samplingRate);
    final TonicSplineBasis basis = new TonicSplineBasis(params.deltaKnot(), samplingRate);
    final CvxEdaFormulator formulator = new CvxEdaFormulator(signal, model, basis, params.alpha(),
        params.gamma());
    final SolverOptions options = SolverOptions.DEFAULT.withRelativeTolerance(params.reltol());

    final SolverResult result;
    final double objective;
    switch (params.solverVariant()) {
      case QUADRATIC_PROGRAM -> {
        result = backend.solve(formulator.quadraticProgram(), options);
        objective = result.primalObjective() + formulator.signalEnergy();
      }
      case CONE_PROGRAM -> {
        result = backend.solve(formulator.coneProgram(), options);
        objective = result.primalObjective();
      }
      default -> throw new IllegalStateException("Unexpected value: " + params.solverVariant());
    }

    if (!result.hasSolution()) {
      throw new SolverFailureException(result.status(),
          "cvxEDA solver " + backend.getName() + " stopped with status " + result.status()
              + " after " + result.iterations() + " iterations (gap " + result.gap() + ")");
    }
    if (result.status() == SolverStatus.OPTIMAL_INACCURATE) {
      logger.warning(() -> "cvxEDA solver " + backend.getName() + " stopped near the optimum ("
          + params.solverVariant() + ", primal residual " + result.primalResidual()
          + ", dual residual " + result.dualResidual() + ", gap " + result.gap()
          + "), using the closest iterate");
    }
    logger.fine(() -> "cvxEDA " + params.solverVariant() + " solved in " + result.iterations()
        + " iterations, objective " + objective);
    return formulator.decode(result.x(), objective, result.iterations());
  }
}
