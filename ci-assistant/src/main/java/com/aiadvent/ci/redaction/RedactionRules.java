package com.aiadvent.ci.redaction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Default redaction cascade. Order matters: a substring matched by an earlier rule is already a
 * placeholder when later rules run, so it keeps the category of the first rule that saw it.
 */
public final class RedactionRules {

  public static final String AWS_KEY_PLACEHOLDER = "[REDACTED_AWS_KEY]";
  public static final String GENERIC_PLACEHOLDER = "[REDACTED]";
  public static final String HEX_PLACEHOLDER = "[REDACTED_HEX]";
  public static final String SK_KEY_PLACEHOLDER = "[REDACTED_SK_KEY]";
  public static final String JWT_PLACEHOLDER = "[REDACTED_JWT]";
  public static final String PEM_KEY_PLACEHOLDER = "[REDACTED_PEM_KEY]";

  private static final List<RedactionRule> DEFAULTS =
      List.of(
          RedactionRule.of("aws-access-key", "AKIA[0-9A-Z]{16}", AWS_KEY_PLACEHOLDER),
          RedactionRule.of(
              "key-value",
              "((?:api[_-]?key|secret|token|password|auth|credential|private[_-]?key)"
                  + "\\s*[:=]\\s*['\"]?)([A-Za-z0-9_\\-]{20,})",
              Pattern.CASE_INSENSITIVE,
              "$1" + GENERIC_PLACEHOLDER),
          RedactionRule.of(
              "env-assignment",
              "^(\\s*(?:export\\s+)?(?:API_KEY|SECRET|TOKEN|PASSWORD|AUTH|CREDENTIAL|"
                  + "PRIVATE_KEY|ACCESS_KEY|DATABASE_URL|DB_PASSWORD)[A-Z_]*\\s*=\\s*).+$",
              // Only \n ends a line here; a lone \r or NEL stays inside the redacted value.
              Pattern.MULTILINE | Pattern.UNIX_LINES | Pattern.CASE_INSENSITIVE,
              "$1" + GENERIC_PLACEHOLDER),
          RedactionRule.of(
              "bearer-token",
              "(Bearer\\s+)[A-Za-z0-9_\\-.]{20,}",
              Pattern.CASE_INSENSITIVE,
              "$1" + GENERIC_PLACEHOLDER),
          RedactionRule.of("github-token", "(gh[ps]_)[A-Za-z0-9]{36,}", "$1" + GENERIC_PLACEHOLDER),
          RedactionRule.of(
              "quoted-hex", "(['\"])[A-Fa-f0-9]{40,}\\1", "\"" + HEX_PLACEHOLDER + "\""),
          RedactionRule.of("sk-api-key", "sk-[A-Za-z0-9_-]{20,}", SK_KEY_PLACEHOLDER),
          RedactionRule.of(
              "jwt",
              "eyJ[A-Za-z0-9_-]{10,}\\.eyJ[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}",
              JWT_PLACEHOLDER),
          RedactionRule.of(
              "pem-private-key",
              "-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?-----END [A-Z ]*PRIVATE KEY-----",
              PEM_KEY_PLACEHOLDER));

  private RedactionRules() {}

  public static List<RedactionRule> defaults() {
    return DEFAULTS;
  }
}
