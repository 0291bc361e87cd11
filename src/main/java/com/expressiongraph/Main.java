package com.expressiongraph;

public class Main {

    public static void main(String[] args) {
        int code = new VisualizeDriver().run(args);
        if (code != 0) System.exit(code);
    }
}
