package org.tsumego.apps.solver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.ForkJoinPool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.oracle.OracleOutputParser;
import org.tsumego.oracle.ProcessOracle;
import org.tsumego.oracle.exceptions.OracleException;
import org.tsumego.sgf.exceptions.SgfException;
import org.tsumego.solver.SolveResult;
import org.tsumego.solver.Solver;
import org.tsumego.solver.SolverNode;
import org.tsumego.util.configuration.SolverConfiguration;
import org.tsumego.util.configuration.SolverConfiguration.CfgItem;

/**
 * Command-line entry point.  Solves the problem in a record and prints the candidate moves.
 *
 * Usage: SolverRunner &lt;record text | record file&gt; [simulations]
 */
public class SolverRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  public static void main(String[] args)
  {
    if ((args.length < 1) || (args.length > 2))
    {
      System.err.println("Usage: SolverRunner <record text | record file> [simulations]");
      System.exit(2);
    }

    SolverConfiguration.logConfig();

    try
    {
      String lRecord = readRecord(args[0]);
      int lSimulations = (args.length > 1) ? Integer.parseInt(args[1]) :
                                             SolverConfiguration.getCfgInt(CfgItem.SIMULATIONS);

      SolveResult lResult;
      try (ProcessOracle lOracle = new ProcessOracle(new OracleOutputParser()))
      {
        Solver lSolver = Solver.createFromConfiguration(lOracle);
        lSolver.getTree().load(lRecord, SolverConfiguration.getCfgBool(CfgItem.PRESIZE_NODE_POOL) ?
                                                                       ForkJoinPool.commonPool() : null);
        lResult = lSolver.solve(lSimulations, SolverConfiguration.getCfgInt(CfgItem.MAX_IN_FLIGHT));
      }

      System.out.println(lResult);
      for (SolverNode lCandidate : lResult.getCandidates())
      {
        System.out.println("  " + lCandidate.getMoveString() +
                           "  visits: " + lCandidate.getVisitCount() +
                           "  average: " + lCandidate.getAverageScore() +
                           "  " + lCandidate.getStatus());
      }
    }
    catch (IOException lEx)
    {
      LOGGER.error("Failed to read record", lEx);
      System.exit(1);
    }
    catch (SgfException lEx)
    {
      LOGGER.error("Invalid record: " + lEx.getMessage());
      System.exit(1);
    }
    catch (OracleException lEx)
    {
      LOGGER.error("Solve aborted: " + lEx.getMessage());
      System.exit(1);
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Solve interrupted");
      Thread.currentThread().interrupt();
      System.exit(1);
    }
  }

  private static String readRecord(String xiArg) throws IOException
  {
    if (xiArg.trim().startsWith("("))
    {
      return xiArg;
    }
    return new String(Files.readAllBytes(Paths.get(xiArg)), StandardCharsets.UTF_8);
  }
}
