package agents.concierge.services;

import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

@ExtendWith(VertxExtension.class)
public class LoggerTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Published lines reach current.csv with sequence numbers on undeploy")
    void writesOnStop(Vertx vertx, VertxTestContext testContext) {
        String current = dir.resolve("logs").resolve("current.csv").toString();

        vertx.deployVerticle(new Logger(dir.toString()))
            .compose(id -> {
                vertx.eventBus().publish("log", "first line,1,LoggerTest,Test,Write");
                vertx.eventBus().publish("log", "second line,3,LoggerTest,Test,Write");
                // Let both deliveries land before stopping
                Promise<Void> settled = Promise.promise();
                vertx.setTimer(200, t -> settled.complete());
                return settled.future().compose(v -> vertx.undeploy(id));
            })
            .compose(v -> vertx.fileSystem().readFile(current))
            .onComplete(testContext.succeeding(buffer -> testContext.verify(() -> {
                String[] lines = buffer.toString().split("\n");
                Assertions.assertEquals(3, lines.length);
                Assertions.assertEquals(Logger.COLUMNS.trim(), lines[0]);
                Assertions.assertTrue(lines[1].startsWith("first line,1,LoggerTest,Test,Write,1,"));
                Assertions.assertTrue(lines[2].startsWith("second line,3,LoggerTest,Test,Write,2,"));
                testContext.completeNow();
            })));
    }
}
