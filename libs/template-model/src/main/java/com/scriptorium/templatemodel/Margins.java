package com.scriptorium.templatemodel;

import java.util.Objects;

/** Page margins of a {@link DocumentStyle}, in layout units. */
public class Margins implements Prototype<Margins> {

    private int top;
    private int bottom;
    private int left;
    private int right;

    public Margins() {}

    public Margins(int top, int bottom, int left, int right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    @Override
    public Margins deepClone() {
        return new Margins(top, bottom, left, right);
    }

    public int getTop() {
        return top;
    }

    public void setTop(int top) {
        this.top = top;
    }

    public int getBottom() {
        return bottom;
    }

    public void setBottom(int bottom) {
        this.bottom = bottom;
    }

    public int getLeft() {
        return left;
    }

    public void setLeft(int left) {
        this.left = left;
    }

    public int getRight() {
        return right;
    }

    public void setRight(int right) {
        this.right = right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Margins other)) {
            return false;
        }
        return top == other.top && bottom == other.bottom && left == other.left && right == other.right;
    }

    @Override
    public int hashCode() {
        return Objects.hash(top, bottom, left, right);
    }

    @Override
    public String toString() {
        return "Margins{top=%d, bottom=%d, left=%d, right=%d}".formatted(top, bottom, left, right);
    }
}
