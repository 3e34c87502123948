package com.mailspider.app.cli;

/** 잘못된 명령행 인자 (알 수 없는 옵션, 값 누락, 정수 아님, 필수 옵션 누락) */
public class CliArgsException extends Exception {
    public CliArgsException(String message) {
        super(message);
    }
}
