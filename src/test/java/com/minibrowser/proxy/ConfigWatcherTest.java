package com.minibrowser.proxy;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.awaitility.Awaitility.await;

class ConfigWatcherTest {

  @Test
  void testFileWatcherReloadsConfig() throws Exception {
    System.setProperty("minibrowser.no-command-listener", "true");
    System.setProperty("minibrowser.no-shutdown-hook", "true");
    Path configFile = Files.createTempFile("mini-browser-watch", ".yml");
    int port1, port2;
    try (ServerSocket s1 = new ServerSocket(0); ServerSocket s2 = new ServerSocket(0)) {
      port1 = s1.getLocalPort();
      port2 = s2.getLocalPort();
    }

    String yaml1 = """
        admin:
          enabled: false
        proxies:
          - name: p1
            port: %d
            type: EMBED
        """.formatted(port1);
    Files.writeString(configFile, yaml1);

    MiniBrowserProxyApplication app = new MiniBrowserProxyApplication();
    CommandLine cmd = new CommandLine(app);

    Thread t = new Thread(() -> cmd.execute("-c", configFile.toAbsolutePath().toString()));
    t.setDaemon(true);
    t.start();

    await().atMost(Duration.ofSeconds(30)).until(() -> accepting(port1));

    // Move the listener to port2
    String yaml2 = """
        admin:
          enabled: false
        proxies:
          - name: p1
            port: %d
            type: EMBED
        """.formatted(port2);
    Files.writeString(configFile, yaml2);

    await().atMost(Duration.ofSeconds(30)).until(() -> accepting(port2));

    await().atMost(Duration.ofSeconds(30)).until(() -> {
      try (Socket s = new Socket()) {
        s.connect(new InetSocketAddress("localhost", port1), 500);
        return false;
      } catch (IOException e) {
        return true;
      }
    });

    app.stop();
    t.join(5000);
    Files.deleteIfExists(configFile);
  }

  private static boolean accepting(int port) {
    try (Socket s = new Socket("localhost", port)) {
      return s.isConnected();
    } catch (IOException e) {
      return false;
    }
  }
}
