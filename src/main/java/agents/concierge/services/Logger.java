package agents.concierge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the <code>log</code> event-bus traffic to CSV.
 *
 * <p>Lines arrive as <code>"message,level,Class,Category,Subcategory"</code>; the logger
 * appends the arrival sequence and epoch millis, keeps them in memory and appends the batch to
 * <code>&lt;data&gt;/logs/current.csv</code> every 20 s. After a day the current file is
 * renamed to its start stamp and a fresh one begins; only the newest 12 renamed files are
 * kept. <code>saveAllDataToFiles_OnTermination</code> forces a write.</p>
 */
public class Logger extends AbstractVerticle {

  static final long WRITE_EVERY_MS = 20_000;
  static final long FILE_LIFETIME_MS = 24L * 60 * 60 * 1000;
  static final int KEEP_ROTATED = 12;
  static final String COLUMNS = "Message,Level,Class,Category,Subcategory,SequenceReceived,EpochTimeMillis\n";

  private static final DateTimeFormatter ROTATED_NAME =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneOffset.UTC);

  private final String logsDir;
  private final String currentFile;

  private final List<String> pending = new ArrayList<>();
  private long received;
  private long fileStartedAt;
  // Writes are chained so a rotation never interleaves with an append
  private Future<Void> lastWrite = Future.succeededFuture();

  public Logger(String dataPath) {
    this.logsDir = dataPath + "/logs";
    this.currentFile = logsDir + "/current.csv";
  }

  @Override
  public void start(Promise<Void> startPromise) {
    FileSystem fs = vertx.fileSystem();
    fs.mkdirs(logsDir)
      .compose(v -> fs.writeFile(currentFile, Buffer.buffer(COLUMNS)))
      .onSuccess(v -> {
        fileStartedAt = System.currentTimeMillis();

        vertx.eventBus().<String>consumer("log", msg -> {
          received++;
          pending.add(msg.body() + "," + received + "," + System.currentTimeMillis() + "\n");
        });
        vertx.eventBus().consumer("saveAllDataToFiles_OnTermination", msg -> write()
          .onFailure(err -> System.err.println("Log write on termination failed: " + err.getMessage())));
        vertx.setPeriodic(WRITE_EVERY_MS, id -> tick());

        vertx.eventBus().publish("logger.ready", "true");
        startPromise.complete();
      })
      .onFailure(err -> {
        System.err.println("Cannot create log directory " + logsDir + ": " + err.getMessage());
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    write().onComplete(ar -> stopPromise.complete());
  }

  private void tick() {
    long now = System.currentTimeMillis();
    Future<Void> done = now - fileStartedAt >= FILE_LIFETIME_MS ? rotate(now) : write();
    done.onFailure(err -> System.err.println("Log write failed: " + err.getMessage()));
  }

  /**
   * Append everything received so far to the current file.
   */
  Future<Void> write() {
    if (pending.isEmpty()) {
      return lastWrite;
    }
    String batch = String.join("", pending);
    pending.clear();
    lastWrite = lastWrite.recover(err -> Future.succeededFuture())
      .compose(v -> vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true)))
      .compose(file -> file.write(Buffer.buffer(batch)).compose(
        v -> file.close(),
        err -> file.close().transform(closed -> Future.<Void>failedFuture(err))));
    return lastWrite;
  }

  private Future<Void> rotate(long now) {
    FileSystem fs = vertx.fileSystem();
    String rotated = logsDir + "/" + ROTATED_NAME.format(Instant.ofEpochMilli(fileStartedAt)) + ".csv";
    return write()
      .compose(v -> fs.move(currentFile, rotated))
      .compose(v -> {
        fileStartedAt = now;
        return fs.writeFile(currentFile, Buffer.buffer(COLUMNS));
      })
      .compose(v -> pruneRotated());
  }

  private Future<Void> pruneRotated() {
    FileSystem fs = vertx.fileSystem();
    return fs.readDir(logsDir, ".*\\.csv").compose(files -> {
      List<String> rotated = files.stream()
        .filter(path -> !path.endsWith("current.csv"))
        .sorted()
        .toList();
      Future<Void> chain = Future.succeededFuture();
      for (int i = 0; i < rotated.size() - KEEP_ROTATED; i++) {
        String stale = rotated.get(i);
        chain = chain.compose(v -> fs.delete(stale));
      }
      return chain;
    });
  }
}
