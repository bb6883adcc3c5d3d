package io.intellixity.relq.query;

public enum Clause { AND, OR }
