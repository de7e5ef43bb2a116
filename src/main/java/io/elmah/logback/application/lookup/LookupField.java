package io.elmah.logback.application.lookup;

/**
 * Message fields resolved through lookups, with their default expressions.
 * <p>The primary expression includes {@code request:*} sources; the fallback is used when the primary cannot
 * be parsed, which is the case whenever no request context provider is configured.</p>
 *
 * @since 1.0.0
 */
public enum LookupField {
  HOSTNAME(
      "property:hostname|property:Hostname|property:HostName|request:host|machinename",
      "property:hostname|property:Hostname|property:HostName|machinename"),
  COOKIES(
      "property:cookies|property:Cookies|request:cookies",
      "property:cookies|property:Cookies"),
  FORM(
      "property:form|property:Form|request:form",
      "property:form|property:Form"),
  QUERY_STRING(
      "property:querystring|property:queryString|property:QueryString|request:querystring",
      "property:querystring|property:queryString|property:QueryString"),
  SERVER_VARIABLES(
      "property:servervariables|property:serverVariables|property:ServerVariables|request:headers",
      "property:servervariables|property:serverVariables|property:ServerVariables"),
  SOURCE("property:source|property:Source|logger"),
  APPLICATION("property:application|property:Application"),
  USER(
      "property:user|property:User|request:user|environment-user",
      "property:user|property:User|environment-user"),
  METHOD(
      "property:method|property:Method|request:method",
      "property:method|property:Method"),
  VERSION("property:version|property:Version"),
  URL(
      "property:url|property:Url|property:URL|request:url",
      "property:url|property:Url|property:URL"),
  TYPE("property:type|property:Type"),
  STATUS_CODE(
      "property:statuscode|property:Statuscode|property:statusCode|property:StatusCode|request:statuscode",
      "property:statuscode|property:Statuscode|property:statusCode|property:StatusCode");

  private final String primary;
  private final String fallback;

  LookupField(String expression) {
    this(expression, expression);
  }

  LookupField(String primary, String fallback) {
    this.primary = primary;
    this.fallback = fallback;
  }

  public String primary() {
    return primary;
  }

  public String fallback() {
    return fallback;
  }
}
