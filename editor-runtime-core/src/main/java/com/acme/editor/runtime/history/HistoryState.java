package com.acme.editor.runtime.history;

public enum HistoryState {
  IDLE,
  RECORDING
}
