package unionfind.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import unionfind.Config;
import unionfind.DisjointSet;

import java.io.PrintStream;

/**
 * Builds a small disjoint set of the elements 1..10, joins a few of them and prints
 * the structure and some representatives along the way.
 */
public class UnionFindDemo {
    private static final Logger logger = LoggerFactory.getLogger(UnionFindDemo.class);

    public static void main(String[] args) {
        new UnionFindDemo().run(System.out);
    }

    public DisjointSet run(PrintStream out) {
        DisjointSet disjointSet = new DisjointSet(Config.withDefaults().withStatsEnabled());
        out.println(disjointSet);

        for (int i = 1; i <= 10; i++) {
            disjointSet.add(i);
        }
        out.println(disjointSet);

        disjointSet.union(1, 2);
        disjointSet.union(3, 5);
        disjointSet.union(3, 6);
        out.println(disjointSet);

        out.println("Find(5): " + disjointSet.find(5));
        out.println("Find(6): " + disjointSet.find(6));
        out.println("Find(1): " + disjointSet.find(1));

        logger.info("{} elements in {} sets, {}", disjointSet.size(), disjointSet.setCount(), disjointSet.getStats());
        return disjointSet;
    }
}
