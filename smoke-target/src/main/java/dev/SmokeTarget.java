package dev;

import com.httpretry.core.http.JdkHttpTransport;
import com.httpretry.core.http.RetryPlugin;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;
import com.httpretry.core.model.RetryConfig;
import com.httpretry.core.model.RetryStats;
import com.httpretry.core.pipeline.PipelineClient;
import com.httpretry.core.util.LoggingConfigurator;
import com.httpretry.core.util.RetryStatsExporter;
import com.httpretry.core.util.YamlConfigLoader;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * 재시도 동작 확인용 로컬 대상 서버.
 *  /flaky?fail=N&key=K      : 키별로 처음 N번은 503, 이후 200 + 요청 본문(없으면 "Hello, world")
 *  /always-503              : 항상 503
 *  /rate-limited?after=S&key=K : 키별 첫 요청은 429 + Retry-After: S, 이후 200
 *  /echo                    : 200 + 요청 본문, X-Received-Length 헤더
 *  /slow?ms=M               : M ms 뒤 200
 *  /hits?key=K              : 키별 누적 요청 수(text)
 *  /reset                   : 카운터 초기화
 */
public class SmokeTarget {

  private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    LoggingConfigurator.init(Path.of("out", "logs"), LoggingConfigurator.levelFromSystemProperty(Level.INFO),
        2 * 1024 * 1024, 5);

    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    HttpServer http = new SmokeTarget().start(port);
    System.out.println("[HR] HTTP  server on  http://localhost:" + http.getAddress().getPort());

    if (args.length > 1 && "--demo".equals(args[1])) {
      demo(URI.create("http://localhost:" + http.getAddress().getPort()));
      http.stop(0);
    }
  }

  /** port=0이면 임의 포트 */
  public HttpServer start(int port) throws IOException {
    HttpServer s = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(s);
    s.setExecutor(Executors.newFixedThreadPool(8, r -> {
      Thread t = new Thread(r, "smoke-target");
      t.setDaemon(true);
      return t;
    }));
    s.start();
    return s;
  }

  public int hits(String key) {
    AtomicInteger n = hits.get(key);
    return n == null ? 0 : n.get();
  }

  // 공통 엔드포인트 배선
  void wireEndpoints(HttpServer s) {
    add(s, "/flaky", ex -> {
      var q = query(ex.getRequestURI());
      int fail = parseInt(q.get("fail"), 2);
      int n = count("flaky:" + q.getOrDefault("key", "default"));
      byte[] body = readBody(ex);
      if (n <= fail) {
        resp(ex, 503, "text/plain", "");
        return;
      }
      String text = body.length == 0 ? "Hello, world" : new String(body, StandardCharsets.UTF_8);
      resp(ex, 200, "text/plain", text);
    });

    add(s, "/always-503", ex -> {
      count("always-503");
      readBody(ex);
      resp(ex, 503, "text/plain", "");
    });

    add(s, "/rate-limited", ex -> {
      var q = query(ex.getRequestURI());
      int n = count("rate-limited:" + q.getOrDefault("key", "default"));
      if (n == 1) {
        ex.getResponseHeaders().set("Retry-After", q.getOrDefault("after", "1"));
        resp(ex, 429, "text/plain", "slow down");
        return;
      }
      resp(ex, 200, "text/plain", "ok");
    });

    add(s, "/echo", ex -> {
      count("echo");
      byte[] body = readBody(ex);
      ex.getResponseHeaders().set("X-Received-Length", String.valueOf(body.length));
      String declared = ex.getRequestHeaders().getFirst("Content-Length");
      if (declared != null) ex.getResponseHeaders().set("X-Declared-Length", declared);
      resp(ex, 200, "application/octet-stream", body);
    });

    add(s, "/slow", ex -> {
      count("slow");
      long ms = parseInt(query(ex.getRequestURI()).get("ms"), 500);
      try {
        Thread.sleep(ms);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
      resp(ex, 200, "text/plain", "late");
    });

    add(s, "/hits", ex -> {
      String key = query(ex.getRequestURI()).getOrDefault("key", "");
      resp(ex, 200, "text/plain", String.valueOf(hits(key)));
    });

    add(s, "/reset", ex -> {
      hits.clear();
      resp(ex, 204, "text/plain", "");
    });
  }

  private int count(String key) {
    return hits.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }

  static void demo(URI base) throws Exception {
    // 작업 디렉터리에 retry.yml이 있으면 사용
    RetryConfig cfg = Files.exists(Path.of("retry.yml")) ? YamlConfigLoader.loadDefault() : RetryConfig.defaults();
    RetryStats stats = new RetryStats();
    PipelineClient client = new PipelineClient(new JdkHttpTransport(cfg))
        .use(RetryPlugin.fromConfig(cfg).withStats(stats));

    HttpResponseData ok = client.send(OutboundRequest.post(base.resolve("/flaky?fail=2&key=demo"), "Hello, world").build());
    System.out.println("[HR] /flaky      -> " + ok.getStatusCode() + " " + ok.bodyAsString());

    HttpResponseData down = client.send(OutboundRequest.get(base.resolve("/always-503")).build());
    System.out.println("[HR] /always-503 -> " + down.getStatusCode());

    System.out.println(new RetryStatsExporter().toJson(stats.snapshot()));
  }

  // ---- helpers ----
  static byte[] readBody(HttpExchange ex) throws IOException {
    try (InputStream in = ex.getRequestBody()) {
      return in.readAllBytes();
    }
  }

  static void resp(HttpExchange ex, int code, String ctype, String body) throws IOException {
    resp(ex, code, ctype, body.getBytes(StandardCharsets.UTF_8));
  }

  static void resp(HttpExchange ex, int code, String ctype, byte[] bytes) throws IOException {
    ex.getResponseHeaders().set("Content-Type", ctype);
    if (code == 204 || bytes.length == 0) {
      ex.sendResponseHeaders(code, -1);
      ex.close();
      return;
    }
    ex.sendResponseHeaders(code, bytes.length);
    try (OutputStream os = ex.getResponseBody()) {
      os.write(bytes);
    }
  }

  static Map<String, String> query(URI u) {
    Map<String, String> m = new HashMap<>();
    String q = u.getRawQuery();
    if (q == null || q.isEmpty()) return m;
    for (String p : q.split("&")) {
      int i = p.indexOf('=');
      if (i < 0) m.put(URLDecoder.decode(p, StandardCharsets.UTF_8), "");
      else m.put(URLDecoder.decode(p.substring(0, i), StandardCharsets.UTF_8),
          URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8));
    }
    return m;
  }

  static int parseInt(String s, int def) {
    try { return s == null ? def : Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return def; }
  }
}
