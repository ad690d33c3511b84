package com.codeheadsystems.netdash.cli;

import com.codeheadsystems.netdash.client.DeviceClientFactory;
import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.DeviceAuthException;
import com.codeheadsystems.netdash.client.exceptions.DeviceTransportException;
import com.codeheadsystems.netdash.client.manager.DeviceClientManager;
import com.codeheadsystems.netdash.client.model.HttpMethod;
import com.codeheadsystems.netdash.client.model.RegistrationStatus;
import com.codeheadsystems.netdash.client.model.RegistrationTicket;
import com.codeheadsystems.netdash.client.model.Session;
import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import com.codeheadsystems.netdash.model.api.ApiVersionInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line client for registering with a device and calling its API.
 *
 * <pre>
 * Usage:
 *   java -jar netdash-cli.jar &lt;command&gt; [arguments] [options]
 *
 * Commands:
 *   register        Request an app token and wait for approval on the device front panel.
 *   status &lt;id&gt;     Print the status of a pending registration.
 *   login           Open a session and print its permissions.
 *   check           Open a session and verify it with the device.
 *   get &lt;path&gt;      Log in if registered, then GET the path and print the JSON envelope.
 *   logout          Open then close a session.
 *   reset           Delete the stored app token.
 *   version         Print the device identification.
 *
 * Options:
 *   --url &lt;url&gt;            Device base URL       (default: $FREEBOX_URL or https://mafreebox.freebox.fr)
 *   --token-file &lt;path&gt;    App token file        (default: $FREEBOX_TOKEN_FILE or data/freebox_token.json)
 *   --api-version &lt;v&gt;      API version segment   (default: $FREEBOX_API_VERSION or v14)
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 usage or request error, 2 authentication failure.
 */
public class DeviceCli {

  static final int OK = 0;
  static final int ERROR = 1;
  static final int AUTH_FAILURE = 2;

  static final Duration POLL_INTERVAL = Duration.ofSeconds(2);
  static final int MAX_POLLS = 90;

  private final DeviceClientManager manager;
  private final ObjectMapper objectMapper;
  private final PrintStream out;
  private final PrintStream err;
  private final Duration pollInterval;

  DeviceCli(DeviceClientManager manager, ObjectMapper objectMapper, PrintStream out, PrintStream err,
            Duration pollInterval) {
    this.manager = manager;
    this.objectMapper = objectMapper;
    this.out = out;
    this.err = err;
    this.pollInterval = pollInterval;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final Invocation invocation;
    try {
      invocation = parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage(System.err);
      System.exit(ERROR);
      return;
    }
    System.exit(launch(invocation, System.getenv(), System.out, System.err));
  }

  /**
   * Builds the client for an invocation and runs it.
   *
   * @param invocation the invocation
   * @param env        the environment
   * @param out        the output
   * @param err        the error output
   * @return the exit code; {@link #ERROR} when the client cannot be built
   */
  static int launch(Invocation invocation, Map<String, String> env, PrintStream out, PrintStream err) {
    final DeviceClientConfig config;
    final DeviceClientManager manager;
    try {
      config = invocation.applyTo(DeviceClientConfig.fromEnvironment(env));
      manager = DeviceClientFactory.create(config);
    } catch (DeviceTransportException | IllegalArgumentException e) {
      err.println("Configuration error: " + e.getMessage());
      return ERROR;
    }
    out.println("Device  : " + config.baseUrl());
    out.println("API     : " + config.apiVersion());
    out.println();
    return new DeviceCli(manager, DeviceClientFactory.objectMapper(), out, err, POLL_INTERVAL).run(invocation);
  }

  /**
   * Parses the command line.
   *
   * @param args the args
   * @return the invocation
   * @throws IllegalArgumentException on a usage error
   */
  static Invocation parse(String[] args) {
    String url = null;
    String tokenFile = null;
    String apiVersion = null;
    final List<String> positional = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--url"         -> url        = value(args, ++i, "--url");
        case "--token-file"  -> tokenFile  = value(args, ++i, "--token-file");
        case "--api-version" -> apiVersion = value(args, ++i, "--api-version");
        default -> {
          if (args[i].startsWith("--")) {
            throw new IllegalArgumentException("Unknown option: " + args[i]);
          }
          positional.add(args[i]);
        }
      }
    }
    if (positional.isEmpty()) {
      throw new IllegalArgumentException("Missing command");
    }
    final String command = positional.get(0);
    final int expected = switch (command) {
      case "register", "login", "check", "logout", "reset", "version" -> 0;
      case "status", "get" -> 1;
      default -> throw new IllegalArgumentException("Unknown command: " + command);
    };
    final List<String> arguments = positional.subList(1, positional.size());
    if (arguments.size() != expected) {
      throw new IllegalArgumentException(command + " expects " + expected + " argument(s)");
    }
    if (command.equals("status")) {
      try {
        Integer.parseInt(arguments.get(0));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Registration id must be a number: " + arguments.get(0), e);
      }
    }
    return new Invocation(command, List.copyOf(arguments), url, tokenFile, apiVersion);
  }

  private static String value(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException(option + " needs a value");
    }
    return args[index];
  }

  /**
   * Runs a parsed invocation.
   *
   * @param invocation the invocation
   * @return the exit code
   */
  int run(Invocation invocation) {
    try {
      return switch (invocation.command()) {
        case "register" -> runRegister();
        case "status" -> runStatus(Integer.parseInt(invocation.arguments().get(0)));
        case "login" -> runLogin();
        case "check" -> runCheck();
        case "get" -> runGet(invocation.arguments().get(0));
        case "logout" -> runLogout();
        case "reset" -> runReset();
        case "version" -> runVersion();
        default -> throw new IllegalArgumentException("Unknown command: " + invocation.command());
      };
    } catch (DeviceAuthException e) {
      err.println("Authentication failure: " + e.getMessage());
      return AUTH_FAILURE;
    } catch (IllegalStateException e) {
      err.println(e.getMessage());
      return ERROR;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return ERROR;
    }
  }

  private int runRegister() {
    out.println("Requesting an app token...");
    final RegistrationTicket ticket = manager.register();
    out.println("Registration " + ticket.trackId() + " requested. Approve it on the device front panel.");
    for (int poll = 0; poll < MAX_POLLS; poll++) {
      final RegistrationStatus status = manager.pollStatus(ticket.trackId());
      switch (status) {
        case GRANTED -> {
          out.println("Registration granted.");
          return OK;
        }
        case DENIED, TIMEOUT -> {
          err.println("Registration " + status.wireValue() + ", discarding the app token.");
          manager.resetCredential();
          return AUTH_FAILURE;
        }
        default -> out.println("  status: " + status.wireValue());
      }
      try {
        Thread.sleep(pollInterval.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        err.println("Interrupted while waiting for approval.");
        return ERROR;
      }
    }
    err.println("Gave up waiting for approval; check later with: status " + ticket.trackId());
    return ERROR;
  }

  private int runStatus(int registrationId) {
    out.println("Registration " + registrationId + ": " + manager.pollStatus(registrationId).wireValue());
    return OK;
  }

  private int runLogin() {
    final Session session = manager.login();
    out.println("Login successful.");
    out.println("  permissions : " + session.permissions());
    return OK;
  }

  private int runCheck() {
    manager.login();
    final boolean valid = manager.checkSession();
    out.println("Session valid: " + valid);
    return valid ? OK : AUTH_FAILURE;
  }

  private int runGet(String path) {
    if (manager.isRegistered()) {
      manager.login();
    }
    final ApiEnvelope<JsonNode> envelope = manager.execute(HttpMethod.GET, path, null);
    try {
      out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope));
    } catch (JsonProcessingException e) {
      err.println("Unable to print the response: " + e.getOriginalMessage());
      return ERROR;
    }
    return envelope.success() ? OK : ERROR;
  }

  private int runLogout() {
    manager.login();
    manager.logout();
    out.println("Logged out.");
    return OK;
  }

  private int runReset() {
    manager.resetCredential();
    out.println("App token deleted.");
    return OK;
  }

  private int runVersion() {
    final Optional<ApiVersionInfo> info = manager.versionInfo();
    if (info.isEmpty()) {
      err.println("Device did not answer /api_version.");
      return ERROR;
    }
    final ApiVersionInfo version = info.get();
    out.println("  model       : " + version.modelIdentifier());
    out.println("  api version : " + version.apiVersion());
    out.println("  device name : " + version.deviceName());
    out.println("  https       : " + version.httpsAvailable() + " (port " + version.httpsPort() + ")");
    return OK;
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: DeviceCli <command> [arguments] [options]");
    err.println();
    err.println("Commands:");
    err.println("  register        Request an app token and wait for approval on the device");
    err.println("  status <id>     Print the status of a pending registration");
    err.println("  login           Open a session and print its permissions");
    err.println("  check           Open a session and verify it with the device");
    err.println("  get <path>      GET an API path, e.g. /system/, and print the envelope");
    err.println("  logout          Open then close a session");
    err.println("  reset           Delete the stored app token");
    err.println("  version         Print the device identification");
    err.println();
    err.println("Options:");
    err.println("  --url <url>           Device base URL      (default: $FREEBOX_URL)");
    err.println("  --token-file <path>   App token file       (default: $FREEBOX_TOKEN_FILE)");
    err.println("  --api-version <v>     API version segment  (default: $FREEBOX_API_VERSION)");
  }

  /**
   * A parsed command line.
   *
   * @param command    the command
   * @param arguments  its positional arguments
   * @param url        the --url option, or null
   * @param tokenFile  the --token-file option, or null
   * @param apiVersion the --api-version option, or null
   */
  record Invocation(String command, List<String> arguments, String url, String tokenFile, String apiVersion) {

    DeviceClientConfig applyTo(DeviceClientConfig config) {
      DeviceClientConfig result = config;
      if (url != null) {
        result = result.withBaseUrl(URI.create(url));
      }
      if (tokenFile != null) {
        result = result.withCredentialFile(tokenFile);
      }
      if (apiVersion != null) {
        result = result.withApiVersion(apiVersion);
      }
      return result;
    }
  }
}
