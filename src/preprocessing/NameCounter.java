package preprocessing;

import java.util.HashSet;
import java.util.Set;

import utils.Config;

/**
 * Source of synthetic names for unnamed nodes within one layout run.
 *
 * A fresh counter is created for every run, so repeated and concurrent runs
 * produce the same names for the same tree. Names already taken by the tree
 * are skipped.
 */
public class NameCounter {

    private final String prefix;
    private final Set<String> taken = new HashSet<>();
    private int count = 0;

    public NameCounter(){
        this(Config.INTERNAL_NAME_PREFIX);
    }

    public NameCounter(String prefix){
        this.prefix = prefix;
    }

    public void reserve(String name){
        taken.add(name);
    }

    public String next(){
        String name;
        do {
            count++;
            name = prefix + count;
        } while(taken.contains(name));
        taken.add(name);
        return name;
    }

    public int getCount(){
        return count;
    }
}
