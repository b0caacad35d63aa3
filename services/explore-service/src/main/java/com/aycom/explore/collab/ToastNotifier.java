package com.aycom.explore.collab;

public interface ToastNotifier {
    void error(String message);
}
