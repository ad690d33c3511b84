package com.codeheadsystems.netdash.client.model;

/**
 * HTTP methods the router API uses.
 */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
