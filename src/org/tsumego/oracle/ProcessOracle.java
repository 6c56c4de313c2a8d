package org.tsumego.oracle;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.oracle.exceptions.OracleException;
import org.tsumego.oracle.exceptions.OracleUnavailableException;
import org.tsumego.util.configuration.SolverConfiguration;
import org.tsumego.util.configuration.SolverConfiguration.CfgItem;

import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Oracle backed by an external tsumego-solving program.
 *
 * Each evaluation runs "&lt;exe&gt; -playtsumego &lt;job&gt; [-ignore &lt;exclusions&gt;]" in the oracle's working
 * directory and parses what the program prints.  Asynchronous evaluations run on a fixed pool of threads owned by this oracle,
 * and the program's output is drained on threads of its own, so the oracle must be closed after use.
 */
public class ProcessOracle implements Oracle, AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final File mExecutable;
  private final File mWorkingDir;
  private final long mTimeout;
  private final OracleOutputParser mOutputParser;
  private final ExecutorService mExecutor;
  private final ExecutorService mStreamReaders;

  /**
   * Create an oracle from the machine-specific configuration.
   *
   * @param xiOutputParser - parser for the program's output.
   */
  public ProcessOracle(OracleOutputParser xiOutputParser)
  {
    this(new File(SolverConfiguration.getCfgStr(CfgItem.ORACLE_EXECUTABLE)),
         configuredWorkingDir(),
         SolverConfiguration.getCfgInt(CfgItem.ORACLE_TIMEOUT),
         SolverConfiguration.getCfgInt(CfgItem.ORACLE_THREADS),
         xiOutputParser);
  }

  /**
   * Create an oracle.
   *
   * @param xiExecutable   - the program.
   * @param xiWorkingDir   - the directory to run it in, or null for the directory containing the program.
   * @param xiTimeout      - time (in milliseconds) after which an evaluation is abandoned.
   * @param xiNumThreads   - number of threads for asynchronous evaluations.
   * @param xiOutputParser - parser for the program's output.
   */
  public ProcessOracle(File xiExecutable,
                       File xiWorkingDir,
                       long xiTimeout,
                       int xiNumThreads,
                       OracleOutputParser xiOutputParser)
  {
    mExecutable = xiExecutable.getAbsoluteFile();
    mWorkingDir = (xiWorkingDir != null) ? xiWorkingDir : mExecutable.getParentFile();
    mTimeout = xiTimeout;
    mOutputParser = xiOutputParser;
    mExecutor = Executors.newFixedThreadPool(xiNumThreads,
                                             new ThreadFactoryBuilder().setNameFormat("Oracle %d")
                                                                       .setDaemon(true)
                                                                       .build());
    mStreamReaders = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat("Oracle reader %d")
                                                                             .setDaemon(true)
                                                                             .build());
  }

  private static File configuredWorkingDir()
  {
    String lDir = SolverConfiguration.getCfgStr(CfgItem.ORACLE_WORKING_DIR);
    return (lDir == null) ? null : new File(lDir);
  }

  /**
   * @return the command line for an evaluation.
   *
   * @param xiJob        - the moves leading to the position.
   * @param xiExclusions - moves the oracle must not suggest, or null.
   */
  public List<String> buildCommand(String xiJob, String xiExclusions)
  {
    List<String> lCommand = new ArrayList<>();
    lCommand.add(mExecutable.getPath());
    lCommand.add("-playtsumego");
    lCommand.add(xiJob);
    if (xiExclusions != null)
    {
      lCommand.add("-ignore");
      lCommand.add(xiExclusions);
    }
    return lCommand;
  }

  @Override
  public EvaluationResult evaluate(String xiJob, String xiExclusions) throws OracleException
  {
    List<String> lCommand = buildCommand(xiJob, xiExclusions);
    LOGGER.debug("Running oracle: " + lCommand);

    Process lProcess;
    try
    {
      lProcess = new ProcessBuilder(lCommand).directory(mWorkingDir).start();
    }
    catch (IOException lEx)
    {
      throw new OracleUnavailableException("Failed to start oracle " + mExecutable, lEx);
    }

    // Drain both streams so that the program can't block on a full pipe.
    CompletableFuture<String> lStdout = CompletableFuture.supplyAsync(() -> readFully(lProcess.getInputStream()),
                                                                      mStreamReaders);
    CompletableFuture<String> lStderr = CompletableFuture.supplyAsync(() -> readFully(lProcess.getErrorStream()),
                                                                      mStreamReaders);

    try
    {
      if (!lProcess.waitFor(mTimeout, TimeUnit.MILLISECONDS))
      {
        throw new OracleUnavailableException("Oracle didn't answer within " + mTimeout + "ms for job '" + xiJob +
                                             "'");
      }

      String lOutput = lStdout.get(mTimeout, TimeUnit.MILLISECONDS);
      int lExitCode = lProcess.exitValue();
      if (lExitCode != 0)
      {
        throw new OracleUnavailableException("Oracle exited with code " + lExitCode + " for job '" + xiJob + "': " +
                                             lStderr.getNow("").strip());
      }

      return mOutputParser.parse(lOutput);
    }
    catch (InterruptedException lEx)
    {
      Thread.currentThread().interrupt();
      throw new OracleUnavailableException("Interrupted waiting for oracle", lEx);
    }
    catch (ExecutionException | TimeoutException lEx)
    {
      throw new OracleUnavailableException("Failed to read oracle output", lEx);
    }
    finally
    {
      lProcess.destroyForcibly();
    }
  }

  @Override
  public CompletableFuture<EvaluationResult> evaluateAsync(String xiJob, String xiExclusions)
  {
    return CompletableFuture.supplyAsync(() ->
    {
      try
      {
        return evaluate(xiJob, xiExclusions);
      }
      catch (OracleException lEx)
      {
        throw new CompletionException(lEx);
      }
    }, mExecutor);
  }

  @Override
  public void close()
  {
    mExecutor.shutdownNow();
    mStreamReaders.shutdownNow();
  }

  private static String readFully(InputStream xiStream)
  {
    try (InputStreamReader lReader = new InputStreamReader(xiStream, StandardCharsets.UTF_8))
    {
      return CharStreams.toString(lReader);
    }
    catch (IOException lEx)
    {
      throw new CompletionException(lEx);
    }
  }
}
