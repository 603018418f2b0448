package com.cankv.constants;

public interface RespProtocol
{
    // Protocol identification used for logging and diagnostics.
    String PROTOCOL = "resp";

    // Leading type tags of a wire unit.
    byte ARRAY = '*';
    byte BULK_STRING = '$';
    byte SIMPLE_STRING = '+';
    byte INTEGER = ':';

    byte CR = '\r';
    byte LF = '\n';

    // Supported command verbs, compared after lower-casing.
    String PING = "ping";
    String ECHO = "echo";
    String GET = "get";
    String SET = "set";

    // Expiry flag accepted by SET.
    String PX = "px";

    // Bulk string replies.
    String PONG = "PONG";
    String OK = "OK";
}
