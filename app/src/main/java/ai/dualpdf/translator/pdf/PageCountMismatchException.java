package ai.dualpdf.translator.pdf;

public class PageCountMismatchException extends MergeException {

    private final int leftPages;
    private final int rightPages;

    public PageCountMismatchException(int leftPages, int rightPages) {
        super("page counts differ: left has " + leftPages + " page(s), right has " + rightPages);
        this.leftPages = leftPages;
        this.rightPages = rightPages;
    }

    public int leftPages() {
        return leftPages;
    }

    public int rightPages() {
        return rightPages;
    }
}
