package dev.ornamental.syncstore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A bean used as a structured stored value in tests.
 */
public class Profile {

	private String name;

	private int visits;

	private List<String> tags = new ArrayList<>();

	public Profile() { }

	public Profile(String name, int visits, List<String> tags) {
		this.name = name;
		this.visits = visits;
		this.tags = new ArrayList<>(tags);
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public int getVisits() {
		return visits;
	}

	public void setVisits(int visits) {
		this.visits = visits;
	}

	public List<String> getTags() {
		return tags;
	}

	public void setTags(List<String> tags) {
		this.tags = tags;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Profile)) {
			return false;
		}
		Profile other = (Profile) o;
		return visits == other.visits && Objects.equals(name, other.name) && Objects.equals(tags, other.tags);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, visits, tags);
	}

	@Override
	public String toString() {
		return "Profile[" + name + ", " + visits + ", " + tags + "]";
	}
}
