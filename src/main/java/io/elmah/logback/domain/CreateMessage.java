package io.elmah.logback.domain;

import java.time.Instant;
import java.util.List;

/**
 * Message submitted to the elmah.io API.
 * <p>Mutable: the on-message hook receives the instance right before it is sent and
 * may enrich or scrub it. Item lists are {@code null} when the field has no value.</p>
 *
 * @since 1.0.0
 */
public final class CreateMessage {
  private String title;
  private String titleTemplate;
  private Severity severity;
  private Instant dateTime;
  private String detail;
  private List<Item> data;
  private String source;
  private String hostname;
  private String application;
  private String user;
  private String method;
  private String version;
  private String url;
  private String type;
  private Integer statusCode;
  private List<Item> serverVariables;
  private List<Item> cookies;
  private List<Item> form;
  private List<Item> queryString;

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getTitleTemplate() {
    return titleTemplate;
  }

  public void setTitleTemplate(String titleTemplate) {
    this.titleTemplate = titleTemplate;
  }

  public Severity getSeverity() {
    return severity;
  }

  public void setSeverity(Severity severity) {
    this.severity = severity;
  }

  public Instant getDateTime() {
    return dateTime;
  }

  public void setDateTime(Instant dateTime) {
    this.dateTime = dateTime;
  }

  public String getDetail() {
    return detail;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  public List<Item> getData() {
    return data;
  }

  public void setData(List<Item> data) {
    this.data = data;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public String getHostname() {
    return hostname;
  }

  public void setHostname(String hostname) {
    this.hostname = hostname;
  }

  public String getApplication() {
    return application;
  }

  public void setApplication(String application) {
    this.application = application;
  }

  public String getUser() {
    return user;
  }

  public void setUser(String user) {
    this.user = user;
  }

  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(Integer statusCode) {
    this.statusCode = statusCode;
  }

  public List<Item> getServerVariables() {
    return serverVariables;
  }

  public void setServerVariables(List<Item> serverVariables) {
    this.serverVariables = serverVariables;
  }

  public List<Item> getCookies() {
    return cookies;
  }

  public void setCookies(List<Item> cookies) {
    this.cookies = cookies;
  }

  public List<Item> getForm() {
    return form;
  }

  public void setForm(List<Item> form) {
    this.form = form;
  }

  public List<Item> getQueryString() {
    return queryString;
  }

  public void setQueryString(List<Item> queryString) {
    this.queryString = queryString;
  }

  @Override
  public String toString() {
    return "CreateMessage{severity=" + severity + ", title='" + title + "', source='" + source + "'}";
  }
}
