package edu.purdue.dsnl.procsim;

public abstract class Event implements Comparable<Event> {
    private static int uidGen = 0;

    private final int uid = uidGen++;

    protected double time;

    public abstract void execute();

    public double getTime() {
        return time;
    }

    @Override
    public int compareTo(Event o) {
        if (time != o.time) {
            return Double.compare(time, o.time);
        }
        return Integer.compare(uid, o.uid);
    }
}
