package com.bookharvest.core.extract;

/** HTML에서 페이지 본문을 만들 수 없을 때. */
public class ParseException extends Exception {
    public ParseException(String message) { super(message); }
    public ParseException(String message, Throwable cause) { super(message, cause); }
}
